package dev.py2flow.analyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered idiom rows. The first row whose matcher accepts a site wins, so
 * more specific multi-link idioms are registered before the general ones.
 *
 * <p>Custom rows extend the converter to project-specific helpers:</p>
 * <pre>{@code
 * var table = IdiomTable.standardWith(new Idiom("dedupe-events", OperationTag.DEDUPE,
 *     site -> site.onFrame() && site.isMethod("dedupe_events"),
 *     site -> Idiom.Match.frame(new Operation.Dedupe(...), 1)));
 * Py2Flow.convert(source, new PatternAnalyzer(table), config);
 * }</pre>
 */
public final class IdiomTable {

    private static final Logger LOG = LoggerFactory.getLogger(IdiomTable.class);

    private final List<Idiom> idioms = new ArrayList<>();

    /** pandas and scikit-learn idioms. */
    public static IdiomTable standard() {
        return standardWith();
    }

    /** The standard rows, with {@code custom} tried before them in the given order. */
    public static IdiomTable standardWith(Idiom... custom) {
        var table = new IdiomTable();
        for (Idiom idiom : custom) {
            table.add(idiom);
        }
        SklearnIdioms.register(table);
        PandasIdioms.register(table);
        if (custom.length > 0) {
            LOG.debug("Idiom table with {} custom row(s)", custom.length);
        }
        return table;
    }

    /** Appends a row; it is tried after every row already present. */
    public IdiomTable add(Idiom idiom) {
        idioms.add(Objects.requireNonNull(idiom, "idiom"));
        return this;
    }

    public List<Idiom> idioms() {
        return Collections.unmodifiableList(idioms);
    }

    /** The match of the first accepting idiom, or null when none applies. */
    Idiom.Match match(IdiomSite site) {
        for (Idiom idiom : idioms) {
            if (idiom.matcher().test(site)) {
                Idiom.Match match = idiom.extractor().apply(site);
                if (match != null) {
                    LOG.debug("Line {}: idiom '{}' matched {} link(s)", site.origin().line(), idiom.name(), match.consumed());
                    return match;
                }
            }
        }
        return null;
    }
}
