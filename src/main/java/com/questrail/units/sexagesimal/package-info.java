/**
 * Sexagesimal Components
 * =============================================================================
 *
 * <p>Conversion between a signed scalar in second units (arcseconds or
 * seconds) and its major / minor / second / fraction components.</p>
 *
 * <h2>Sign Rules</h2>
 * <ul>
 *   <li>Decomposed components are magnitudes; the sign is carried separately.</li>
 *   <li>When composing, the first non-zero component decides the sign of the
 *       whole value.</li>
 * </ul>
 *
 * <p>The codec is unit-agnostic: degrees and hours nest identically.</p>
 */
package com.questrail.units.sexagesimal;
