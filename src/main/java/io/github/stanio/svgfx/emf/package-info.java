/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */

/**
 * Minimal Enhanced Metafile (EMF) writer for the fallback representation.
 *
 * @see  <a href="https://learn.microsoft.com/en-us/openspecs/windows_protocols/ms-emf/"
 *              >[MS-EMF]: Enhanced Metafile Format</a>
 */
package io.github.stanio.svgfx.emf;
