/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.RenderStrategy;
import io.github.stanio.svgfx.policy.VectorApproximation;

/**
 * {@code feComponentTransfer}.  Transfer function attributes are flattened
 * into parameters named after the {@code feFuncX} child:
 * {@code funcR.type}, {@code funcR.tableValues}, {@code funcR.slope},
 * {@code funcR.intercept}, {@code funcR.amplitude}, {@code funcR.exponent},
 * {@code funcR.offset}, likewise for {@code funcG}, {@code funcB}, and
 * {@code funcA}.
 * <p>
 * Recognized natively: binary threshold ({@code <a:biLevel>}), uniform
 * gamma ({@code <a:gamma>}, {@code <a:invGamma>}), inversion ({@code
 * <a:inv>}).  Linear transfers are approximated with {@code <a:lum>} and
 * {@code <a:alphaModFix>}.</p>
 */
public class ComponentTransferFilter extends AbstractFilter {

    enum Form {
        IDENTITY(0),
        THRESHOLD(0.2),
        GAMMA(0.2),
        INVERSION(0.2),
        LINEAR(0.4),
        GENERAL(0.9);

        final double complexity;

        private Form(double complexity) {
            this.complexity = complexity;
        }
    }

    static final String[] CHANNELS = { "funcR", "funcG", "funcB", "funcA" };

    private static final double TOLERANCE = 1e-6;

    private static final VectorApproximation approximation =
            VectorApproximation.of(params -> classify(params) != Form.GENERAL, 0.5);

    public ComponentTransferFilter() {
        super(PrimitiveKind.COMPONENT_TRANSFER);
    }


    /**
     * Single channel transfer function.
     */
    static final class Function {

        final String type;
        final double[] tableValues;
        final double slope;
        final double intercept;
        final double amplitude;
        final double exponent;
        final double offset;

        Function(Parameters params, String channel) {
            type = params.string(channel + ".type", "identity");
            tableValues = params.numbers(channel + ".tableValues");
            slope = params.number(channel + ".slope", 1);
            intercept = params.number(channel + ".intercept", 0);
            amplitude = params.number(channel + ".amplitude", 1);
            exponent = params.number(channel + ".exponent", 1);
            offset = params.number(channel + ".offset", 0);
        }

        boolean isIdentity() {
            switch (type) {
            case "identity":
                return true;
            case "linear":
                return near(slope, 1) && near(intercept, 0);
            case "gamma":
                return near(amplitude, 1) && near(exponent, 1) && near(offset, 0);
            case "table":
                return tableValues.length == 0
                        || (tableValues.length == 2
                                && near(tableValues[0], 0) && near(tableValues[1], 1));
            case "discrete":
                return tableValues.length == 0;
            default:
                return false;
            }
        }

        boolean isThreshold() {
            return type.equals("discrete") && tableValues.length == 2
                    && near(tableValues[0], 0) && near(tableValues[1], 1);
        }

        boolean isInversion() {
            switch (type) {
            case "table":
                return tableValues.length == 2
                        && near(tableValues[0], 1) && near(tableValues[1], 0);
            case "linear":
                return near(slope, -1) && near(intercept, 1);
            default:
                return false;
            }
        }

        boolean isPureGamma() {
            return type.equals("gamma") && near(amplitude, 1) && near(offset, 0);
        }

        boolean isLinear() {
            return type.equals("linear");
        }

        double apply(double c) {
            switch (type) {
            case "linear":
                return slope * c + intercept;
            case "gamma":
                return amplitude * Math.pow(c, exponent) + offset;
            case "table":
                if (tableValues.length == 0)
                    return c;
                if (tableValues.length == 1)
                    return tableValues[0];
                int n = tableValues.length - 1;
                int k = Math.min((int) Math.floor(c * n), n - 1);
                return tableValues[k] + (c * n - k) * (tableValues[k + 1] - tableValues[k]);
            case "discrete":
                if (tableValues.length == 0)
                    return c;
                int steps = tableValues.length;
                return tableValues[Math.min((int) Math.floor(c * steps), steps - 1)];
            default:
                return c;
            }
        }

        private static boolean near(double value, double expected) {
            return Math.abs(value - expected) <= TOLERANCE;
        }

    } // class Function


    static Function[] functions(Parameters params) {
        Function[] funcs = new Function[CHANNELS.length];
        for (int i = 0; i < CHANNELS.length; i++) {
            funcs[i] = new Function(params, CHANNELS[i]);
        }
        return funcs;
    }

    static Form classify(Parameters params) {
        Function[] funcs = functions(params);
        Function alpha = funcs[3];

        boolean identity = true;
        boolean threshold = true;
        boolean linear = true;
        for (Function f : funcs) {
            if (f.isIdentity())
                continue;

            identity = false;
            threshold &= f.isThreshold();
            linear &= f.isLinear();
        }
        if (identity)
            return Form.IDENTITY;
        if (threshold)
            return Form.THRESHOLD;

        if (alpha.isIdentity()) {
            if (funcs[0].isInversion() && funcs[1].isInversion() && funcs[2].isInversion())
                return Form.INVERSION;

            if (funcs[0].isPureGamma() && funcs[1].isPureGamma() && funcs[2].isPureGamma()
                    && funcs[0].exponent == funcs[1].exponent
                    && funcs[1].exponent == funcs[2].exponent)
                return Form.GAMMA;
        }

        // Uniform slope/intercept across the color channels
        if (linear && sameLinear(funcs[0], funcs[1]) && sameLinear(funcs[1], funcs[2]))
            return Form.LINEAR;

        return Form.GENERAL;
    }

    private static boolean sameLinear(Function a, Function b) {
        if (a.isIdentity() && b.isIdentity())
            return true;

        return a.type.equals(b.type) && a.slope == b.slope && a.intercept == b.intercept;
    }

    @Override
    public double complexityScore(Parameters params) {
        return classify(params).complexity;
    }

    @Override
    public Optional<VectorApproximation> vectorApproximation() {
        return Optional.of(approximation);
    }

    @Override
    public PrimitiveOutput apply(Parameters params,
                                 List<PrimitiveOutput> inputs,
                                 FilterContext context)
            throws FilterPrimitiveException {
        PrimitiveOutput source = input(inputs, 0, context);
        Function[] funcs = functions(params);
        Form form = classify(params);

        List<DrawingCommand> recolored = new ArrayList<>(source.commands().size());
        for (DrawingCommand cmd : source.commands()) {
            recolored.add(form == Form.IDENTITY ? cmd
                                                : cmd.recolor(transfer(cmd.color(), funcs)));
        }
        context.checkpoint();

        String fragment = "";
        if (context.strategy().compareTo(RenderStrategy.VECTOR_APPROX) <= 0) {
            fragment = fragment(form, funcs);
        }
        return PrimitiveOutput.of(fragment, recolored, source.bounds());
    }

    private static String fragment(Form form, Function[] funcs) {
        switch (form) {
        case THRESHOLD:
            return "<a:biLevel thresh=\"50000\"/>";
        case INVERSION:
            return "<a:inv/>";
        case GAMMA:
            return funcs[0].exponent < 1 ? "<a:gamma/>" : "<a:invGamma/>";
        case LINEAR:
            StringBuilder buf = new StringBuilder();
            Function color = funcs[0].isIdentity()
                             ? (funcs[1].isIdentity() ? funcs[2] : funcs[1])
                             : funcs[0];
            if (!color.isIdentity()) {
                buf.append("<a:lum bright=\"").append(DrawingML.percent(color.intercept))
                   .append("\" contrast=\"").append(DrawingML.percent(color.slope - 1))
                   .append("\"/>");
            }
            Function alpha = funcs[3];
            if (!alpha.isIdentity()) {
                buf.append("<a:alphaModFix amt=\"")
                   .append(DrawingML.percent(clamp(alpha.slope, 0, 1))).append("\"/>");
            }
            return buf.toString();
        default:
            return "";
        }
    }

    static int transfer(int rgb, Function[] funcs) {
        int result = 0;
        for (int channel = 0; channel < 3; channel++) {
            double c = ((rgb >> (16 - 8 * channel)) & 0xFF) / 255.0;
            double value = clamp(funcs[channel].apply(c), 0, 1);
            result = (result << 8) | (int) Math.round(value * 255);
        }
        return result;
    }

}
