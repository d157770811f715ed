/**
 * Template Formatting
 * =============================================================================
 *
 * <p>This package defines the <strong>formatting layer</strong> shared by the
 * sexagesimal quantities ({@code Angle}, {@code Time}). A quantity exposes its
 * canonical scalar and a {@link com.questrail.units.format.TemplateDialect};
 * a {@link com.questrail.units.format.FormatEngine} turns a template such as
 * {@code +0d°0m'0s".3f} into text.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Formattable (scalar + dialect)
 *        → FormatEngine.render(template, quantity)
 *            → SexagesimalCodec.decompose   (components at the rounding place)
 *                → rendered text
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Templates are scanned once; substituted values are never re-scanned.</li>
 *   <li>Engine behavior that is a matter of taste (default rounding place,
 *       fraction padding) lives in {@link com.questrail.units.format.FormatOptions}.</li>
 *   <li>printf-style templates of decimal quantities ({@code Distance},
 *       {@code Velocity}) are not handled here.</li>
 * </ul>
 */
package com.questrail.units.format;
