package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.error.FieldMissingException;
import com.elssolution.bmsdashboard.error.FieldUnparseableException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;

/**
 * Positional decoder for comma-separated controller payloads.
 * Fields carry no labels on the wire, only their position.
 */
public class FieldDecoder {

    private static final String SEPARATOR = ",";

    public DecodedFields decode(String payload, DecodePlan plan)
            throws FieldMissingException, FieldUnparseableException {
        String[] tokens = tokenize(payload);
        LinkedHashMap<String, Number> out = new LinkedHashMap<>();
        int pos = 0;
        for (FieldSpec f : plan.fields()) {
            pos += f.skip();
            if (pos >= tokens.length) {
                throw new FieldMissingException(pos, f.name());
            }
            String raw = tokens[pos].trim();
            out.put(f.name(), parse(raw, pos, f));
            pos++;
        }
        return new DecodedFields(out);
    }

    /**
     * Millivolt series: integer samples, no scaling. Blank tokens read as 0 (a dead
     * tap), which the sanitizer then treats as an outlier.
     */
    public int[] decodeMillivolts(String payload, SeriesPlan plan)
            throws FieldMissingException, FieldUnparseableException {
        String[] tokens = seriesTokens(payload, plan);
        int[] out = new int[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            int pos = plan.skip() + i;
            long raw = parseSample(tokens[i], pos, plan);
            if (raw < 0 || raw > Integer.MAX_VALUE) {
                throw new FieldUnparseableException(pos, plan.key() + "[" + i + "]", tokens[i], null);
            }
            out[i] = (int) Math.round(raw / plan.scale());
        }
        return out;
    }

    /** Temperature series: integer raw samples divided by the plan's scale. */
    public double[] decodeCelsius(String payload, SeriesPlan plan)
            throws FieldMissingException, FieldUnparseableException {
        String[] tokens = seriesTokens(payload, plan);
        double[] out = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            out[i] = parseSample(tokens[i], plan.skip() + i, plan) / plan.scale();
        }
        return out;
    }

    // ---- internals ----

    private static String[] tokenize(String payload) {
        return payload.split(SEPARATOR, -1);
    }

    private static String[] seriesTokens(String payload, SeriesPlan plan) throws FieldMissingException {
        String[] tokens = tokenize(payload);
        int end = tokens.length;
        // firmware sometimes terminates the list with a separator
        if (end > plan.skip() && tokens[end - 1].isBlank()) end--;
        if (end < plan.skip()) {
            throw new FieldMissingException(end, plan.key() + " header");
        }
        String[] samples = new String[end - plan.skip()];
        System.arraycopy(tokens, plan.skip(), samples, 0, samples.length);
        return samples;
    }

    private static long parseSample(String token, int pos, SeriesPlan plan) throws FieldUnparseableException {
        String raw = token.trim();
        if (raw.isEmpty()) return 0L;
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new FieldUnparseableException(pos, plan.key() + "[" + (pos - plan.skip()) + "]", raw, e);
        }
    }

    private static Number parse(String raw, int pos, FieldSpec f) throws FieldUnparseableException {
        try {
            switch (f.type()) {
                case INTEGER:
                    long l = Long.parseLong(raw);
                    // counts and indices; anything beyond int range is a corrupt token
                    if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                        throw new FieldUnparseableException(pos, f.name(), raw,
                                new ArithmeticException("integer overflow"));
                    }
                    return f.scale() == 1.0 ? (Number) l : (Number) (l / f.scale());
                case DECIMAL:
                    // BigDecimal rejects NaN, Infinity, hex and type suffixes
                    return new BigDecimal(raw).doubleValue() / f.scale();
                default:
                    throw new IllegalStateException("unknown field type " + f.type());
            }
        } catch (NumberFormatException e) {
            throw new FieldUnparseableException(pos, f.name(), raw, e);
        }
    }
}
