package tomo.ext.nxstack.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves identifier range specifications into sorted, duplicate-free sets.
 *
 * <p>A specification is a comma-separated list of clauses, each one of:</p>
 * <ul>
 *   <li>{@code N} - a single identifier</li>
 *   <li>{@code N-M} - every identifier from N to M inclusive, step 1</li>
 *   <li>{@code N-M:S} - every identifier from N to M inclusive, step S</li>
 * </ul>
 *
 * <p>Scan and projection numbers are non-negative integers. Rotation angles are decimals and
 * may be negative, e.g. {@code -90-90:0.5}. The resolved set is the union of the include
 * specification and the include list file, minus the exclude specification. An empty
 * result means the axis is unfiltered when nothing was requested, and is returned as-is
 * otherwise; the caller decides whether that is fatal.</p>
 *
 * <pre>{@code
 * IdentifierRangeResolver.resolveIntegers("100-103,110,120-122", null, "121");
 * // [100, 101, 102, 103, 110, 120, 122]
 * }</pre>
 */
public final class IdentifierRangeResolver {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierRangeResolver.class);

    private static final String DECIMAL = "-?\\d+(?:\\.\\d*)?";
    private static final String INTEGER = "\\d+";

    private static final Pattern DECIMAL_CLAUSE = Pattern.compile(
            "^(" + DECIMAL + ")(?:-(" + DECIMAL + ")(?::(\\d+(?:\\.\\d*)?))?)?$");
    private static final Pattern INTEGER_CLAUSE = Pattern.compile(
            "^(" + INTEGER + ")(?:-(" + INTEGER + ")(?::(" + INTEGER + "))?)?$");

    /** Upper bound on the identifiers a single clause may expand to. */
    static final int MAX_CLAUSE_SIZE = 1_000_000;

    private IdentifierRangeResolver() {
        // Utility class - no instantiation
    }

    /**
     * Resolves a scan or projection axis.
     *
     * @param includeSpec     range specification, may be null or blank
     * @param includeListFile file with one identifier per line, may be null
     * @param excludeSpec     range specification to subtract, may be null or blank
     * @return the resolved identifiers in ascending order
     * @throws SpecSyntaxException if any input is malformed
     */
    public static NavigableSet<Integer> resolveIntegers(String includeSpec, Path includeListFile, String excludeSpec) {
        NavigableSet<BigDecimal> resolved = resolve(includeSpec, includeListFile, excludeSpec, true);
        NavigableSet<Integer> ids = new TreeSet<>();
        for (BigDecimal value : resolved) {
            try {
                ids.add(value.intValueExact());
            } catch (ArithmeticException e) {
                throw new SpecSyntaxException("Identifier " + value.toPlainString() + " is not a valid integer", e);
            }
        }
        return ids;
    }

    /**
     * Resolves the rotation angle axis.
     *
     * @see #resolveIntegers(String, Path, String)
     */
    public static NavigableSet<Double> resolveAngles(String includeSpec, Path includeListFile, String excludeSpec) {
        NavigableSet<Double> angles = new TreeSet<>();
        for (BigDecimal value : resolve(includeSpec, includeListFile, excludeSpec, false)) {
            angles.add(value.doubleValue());
        }
        return angles;
    }

    private static NavigableSet<BigDecimal> resolve(String includeSpec, Path includeListFile, String excludeSpec,
                                                    boolean integral) {
        NavigableSet<BigDecimal> included = parseSpec(includeSpec, integral);
        if (includeListFile != null) {
            included.addAll(readListFile(includeListFile, integral));
        }
        NavigableSet<BigDecimal> excluded = parseSpec(excludeSpec, integral);
        int before = included.size();
        included.removeAll(excluded);
        if (!excluded.isEmpty()) {
            logger.debug("Excluded {} of {} identifiers", before - included.size(), before);
        }
        return included;
    }

    /**
     * Parses a specification into its expanded identifiers.
     *
     * @param spec     the specification, may be null or blank
     * @param integral true for scan/projection axes
     * @return the identifiers, ascending, compared by numeric value
     */
    static NavigableSet<BigDecimal> parseSpec(String spec, boolean integral) {
        NavigableSet<BigDecimal> values = new TreeSet<>();
        if (spec == null || spec.isBlank()) {
            return values;
        }
        for (String raw : spec.split(",", -1)) {
            String clause = raw.trim();
            if (clause.isEmpty()) {
                throw new SpecSyntaxException("Empty clause in range specification '" + spec + "'");
            }
            expandClause(clause, integral, values);
        }
        return values;
    }

    private static void expandClause(String clause, boolean integral, NavigableSet<BigDecimal> into) {
        Matcher m = (integral ? INTEGER_CLAUSE : DECIMAL_CLAUSE).matcher(clause);
        if (!m.matches()) {
            throw new SpecSyntaxException("Malformed clause '" + clause + "'; expected "
                    + (integral ? "non-negative integers as " : "numbers as ") + "START[-END[:STEP]]");
        }
        BigDecimal start = new BigDecimal(m.group(1));
        if (m.group(2) == null) {
            into.add(start);
            return;
        }
        BigDecimal end = new BigDecimal(m.group(2));
        BigDecimal step = m.group(3) == null ? BigDecimal.ONE : new BigDecimal(m.group(3));
        if (end.compareTo(start) < 0) {
            throw new SpecSyntaxException("End " + m.group(2) + " is smaller than start " + m.group(1)
                    + " in clause '" + clause + "'");
        }
        if (step.signum() <= 0) {
            throw new SpecSyntaxException("Step must be positive in clause '" + clause + "'");
        }
        BigDecimal count = end.subtract(start).divideToIntegralValue(step);
        if (count.compareTo(BigDecimal.valueOf(MAX_CLAUSE_SIZE)) >= 0) {
            throw new SpecSyntaxException("Clause '" + clause + "' expands to more than " + MAX_CLAUSE_SIZE + " identifiers");
        }
        for (BigDecimal v = start; v.compareTo(end) <= 0; v = v.add(step)) {
            into.add(v);
        }
    }

    /**
     * Reads the first whitespace-delimited column of every non-blank line.
     */
    static NavigableSet<BigDecimal> readListFile(Path listFile, boolean integral) {
        NavigableSet<BigDecimal> values = new TreeSet<>();
        Pattern token = Pattern.compile(integral ? INTEGER : DECIMAL);
        try (BufferedReader reader = Files.newBufferedReader(listFile, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                String first = trimmed.split("\\s+", 2)[0];
                if (!token.matcher(first).matches()) {
                    throw new SpecSyntaxException("Invalid identifier '" + first + "' at line " + lineNumber + " of " + listFile);
                }
                values.add(new BigDecimal(first));
            }
        } catch (IOException e) {
            throw new SpecSyntaxException("Cannot read identifier list file " + listFile, e);
        }
        logger.debug("Read {} identifiers from {}", values.size(), listFile);
        return values;
    }
}
