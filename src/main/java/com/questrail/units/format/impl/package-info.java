/**
 * Template Formatting: Default Implementation
 * =============================================================================
 *
 * <p>The concrete engine and the tokenizer it relies on.</p>
 *
 * <pre>
 *   template
 *        → TemplateTokenizer.tokenize   (literal / sign / component / continuous / fraction)
 *        → rounding place = largest Nf
 *        → SexagesimalCodec.decompose
 *        → DefaultFormatEngine substitutes each segment once
 * </pre>
 *
 * <p>Segments are package-private; callers only see
 * {@link com.questrail.units.format.impl.DefaultFormatEngine}.</p>
 */
package com.questrail.units.format.impl;
