/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.graph;

import java.util.Collections;
import java.util.List;

/**
 * Signals a dependency cycle among filter primitives, including a primitive
 * referencing its own result.
 */
public class CyclicFilterGraphException extends FilterGraphException {

    private static final long serialVersionUID = -2741036563087424329L;

    private final List<String> cycle;

    public CyclicFilterGraphException(List<String> cycle) {
        super(cycle.get(0), "Dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = Collections.unmodifiableList(cycle);
    }

    /**
     * {@return the ids of the primitives forming the cycle, the first one
     * repeated at the end}
     */
    public List<String> cycle() {
        return cycle;
    }

}
