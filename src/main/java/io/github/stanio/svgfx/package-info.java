/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */

/**
 * Converts SVG filter effects into DrawingML effect markup, falling back to
 * Enhanced Metafile pictures, and PNG bitmaps as a last resort.
 * <p>
 * A {@link io.github.stanio.svgfx.FilterRuntime} owns the shared services;
 * a {@link io.github.stanio.svgfx.chain.FilterChain} executes one
 * {@link io.github.stanio.svgfx.graph.FilterGraph} against the geometry of
 * the filtered element.</p>
 *
 * @see  <a href="https://www.w3.org/TR/filter-effects-1/">Filter Effects
 *          Module Level 1</a>
 */
package io.github.stanio.svgfx;
