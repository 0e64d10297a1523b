/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.yaml.lsp.syntax;

import java.math.BigInteger;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Determines the JSON type of plain YAML scalars, using the YAML 1.2 core
 * schema rules.
 */
final class Scalars {
    private static final Set<String> NULLS = Set.of("null", "Null", "NULL", "~", "");
    private static final Set<String> TRUES = Set.of("true", "True", "TRUE");
    private static final Set<String> FALSES = Set.of("false", "False", "FALSE");

    private static final Pattern DECIMAL = Pattern.compile("^[-+]?[0-9]+$");
    private static final Pattern OCTAL = Pattern.compile("^0o[0-7]+$");
    private static final Pattern HEX = Pattern.compile("^0x[0-9a-fA-F]+$");
    private static final Pattern FLOAT = Pattern.compile("^[-+]?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)([eE][-+]?[0-9]+)?$");
    private static final Pattern NAN = Pattern.compile("^\\.(nan|NaN|NAN)$");
    private static final Pattern INFINITY = Pattern.compile("^[-+]?\\.(inf|Inf|INF)$");

    private Scalars() {
    }

    /**
     * @param value The scalar's value
     * @param plain Whether the scalar was written unquoted. Quoted scalars
     *              are always strings.
     * @param start The start offset of the scalar
     * @param end The end offset of the scalar
     * @return The node for the scalar
     */
    static Syntax.Node scalar(String value, boolean plain, int start, int end) {
        if (!plain) {
            return new Syntax.Node.Str(start, end, value, true);
        }
        if (NULLS.contains(value)) {
            return new Syntax.Node.Null(start, end, false);
        }
        if (TRUES.contains(value)) {
            return new Syntax.Node.Bool(start, end, true);
        }
        if (FALSES.contains(value)) {
            return new Syntax.Node.Bool(start, end, false);
        }
        if (DECIMAL.matcher(value).matches()) {
            String digits = value.startsWith("+") ? value.substring(1) : value;
            return new Syntax.Node.Num(start, end, narrow(new BigInteger(digits)), true);
        }
        if (OCTAL.matcher(value).matches()) {
            return new Syntax.Node.Num(start, end, narrow(new BigInteger(value.substring(2), 8)), true);
        }
        if (HEX.matcher(value).matches()) {
            return new Syntax.Node.Num(start, end, narrow(new BigInteger(value.substring(2), 16)), true);
        }
        if (FLOAT.matcher(value).matches()) {
            return new Syntax.Node.Num(start, end, Double.parseDouble(value), false);
        }
        if (NAN.matcher(value).matches()) {
            return new Syntax.Node.Num(start, end, Double.NaN, false);
        }
        if (INFINITY.matcher(value).matches()) {
            double inf = value.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            return new Syntax.Node.Num(start, end, inf, false);
        }
        return new Syntax.Node.Str(start, end, value, false);
    }

    private static Number narrow(BigInteger value) {
        if (value.bitLength() < 64) {
            return value.longValue();
        }
        return value;
    }
}
