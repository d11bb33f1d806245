/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */

/**
 * Filter graph execution: dependency resolution, scheduling, and result
 * assembly.
 */
package io.github.stanio.svgfx.chain;
