package org.yaric.catalog;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RGB vegetation indices from Wernette et al., Starý et al. and George et al., plus short aliases.
 * <p>
 * Formulas may embed other indices with {@code func_index(NAME)}; these are expanded recursively into
 * parenthesised sub-formulas. {@code func_band_*} calls are left for the evaluator.
 * Entries mapped to {@code null} are known names without a published formula.
 */
public class BuiltInIndexCatalog implements IndexCatalog {

    private static final Logger LOGGER = Logger.getLogger(BuiltInIndexCatalog.class.getName());

    private static final Pattern INDEX_REFERENCE = Pattern.compile("func_index\\(\\s*(\\w+)\\s*\\)");

    static final Map<String, String> BUILT_IN_FORMULAS;

    static {
        final Map<String, String> f = new LinkedHashMap<>();
        f.put("Rnorm", "R / func_band_max(R)");
        f.put("Gnorm", "G / func_band_max(G)");
        f.put("Bnorm", "B / func_band_max(B)");
        f.put("Rrefl_stary", "R / (R + G + B)");
        f.put("Grefl_stary", "G / (R + G + B)");
        f.put("Brefl_stary", "B / (R + G + B)");
        f.put("ExR_stary", null);
        f.put("ExG_stary", "2 * func_index(Grefl_stary) - func_index(Rrefl_stary) - func_index(Brefl_stary)");
        f.put("ExGR_stary", "func_index(ExG_stary) - func_index(ExR_stary)");
        f.put("ExR_wernette", "1.4 * R - G");
        f.put("ExG_wernette", "2 * G - R - B");
        f.put("ExB_wernette", "1.4 * B - G");
        f.put("ExGR_wernette", "func_index(ExG_wernette) - func_index(ExR_wernette)");
        f.put("NGRDI_wernette", "(G - R) / (G + R)");
        f.put("MGRVI_wernette", "(G^2 - R^2) / (G^2 + R^2)");
        f.put("GLI_wernette", "(2 * G - R - B) / (2 * G + R + B)");
        f.put("GLI_stary", "((G - R)+ (G - B)) / (2 * G + R + B)");
        f.put("RGBVI_wernette", "(G - (B * R)) / (G^2 + (B * R))");
        f.put("RGBVI_stary", "(G ^ 2 - (B * R)) / (G ^ 2 + (B * R))");
        f.put("IKAW_wernette", "(R - B) / (R + B)");
        f.put("GLA_wernette", "((G - R) + (G - B)) / ((G + R) + (G + B))");
        f.put("Gperc_stary", "G / (R + G + B)");
        f.put("VARI_stary", "(G - R) / (G + R - B)");
        f.put("TGI_stary", "G - 0.39 * R - 0.61 * B");
        f.put("ExR_george", "1.4 * func_index(r_george) - func_index(g_george)");
        f.put("ExG_george", "2 * func_index(g_george) - func_index(r_george) - func_index(b_george)");
        f.put("ExGR_george", "func_index(ExG_george) - func_index(ExR_george)");
        f.put("r_george", "func_index(Rnorm) / (func_index(Rnorm) + func_index(Gnorm) + func_index(Bnorm))");
        f.put("g_george", "func_index(Gnorm) / (func_index(Rnorm) + func_index(Gnorm) + func_index(Bnorm))");
        f.put("b_george", "func_index(Bnorm) / (func_index(Rnorm) + func_index(Gnorm) + func_index(Bnorm))");
        f.put("NGRDI_stary", "(G - R) / (G + R)");
        f.put("ExGRnorm_george", "(func_index(ExGR_george) + 2.4) / 5.4");
        // Short names
        f.put("ExG", "func_index(ExG_wernette)");
        f.put("ExR", "func_index(ExR_wernette)");
        f.put("ExB", "func_index(ExB_wernette)");
        f.put("ExGR", "func_index(ExGR_wernette)");
        f.put("NGRDI", "func_index(NGRDI_wernette)");
        BUILT_IN_FORMULAS = Collections.unmodifiableMap(f);
    }

    private final Map<String, String> formulas;

    public BuiltInIndexCatalog() {
        this(Collections.emptyMap());
    }

    /**
     * @param customFormulas additional formulas; a custom entry replaces a built-in one of the same name
     */
    public BuiltInIndexCatalog(final Map<String, String> customFormulas) {
        this.formulas = new LinkedHashMap<>(BUILT_IN_FORMULAS);
        if (customFormulas != null) {
            customFormulas.forEach((name, formula) -> {
                if (this.formulas.containsKey(name)) {
                    LOGGER.info("Custom formula overrides built-in index " + name);
                }
                this.formulas.put(name, formula);
            });
        }
    }

    @Override
    public IndexDefinition resolve(final String indexName) throws UnknownIndexException {
        final String formula = expand(indexName, new ArrayDeque<>());
        final IndexDefinition definition = new IndexDefinition(indexName, formula, FormulaSymbols.scan(formula));
        LOGGER.log(Level.FINE, "Resolved {0} -> {1} (bands {2})",
                new Object[]{indexName, formula, definition.requiredBands()});
        return definition;
    }

    @Override
    public Set<String> names() {
        final Set<String> names = new TreeSet<>();
        formulas.forEach((name, formula) -> {
            if (formula != null && !formula.isBlank()) names.add(name);
        });
        return names;
    }

    private String expand(final String indexName, final Deque<String> path) throws UnknownIndexException {
        if (!formulas.containsKey(indexName)) {
            throw new UnknownIndexException(indexName, describe(path, "Unsupported index: " + indexName));
        }
        final String formula = formulas.get(indexName);
        if (formula == null || formula.isBlank()) {
            throw new UnknownIndexException(indexName, describe(path, "No formula defined for index: " + indexName));
        }
        if (path.contains(indexName)) {
            throw new UnknownIndexException(indexName, describe(path, "Circular reference to index: " + indexName));
        }

        path.addLast(indexName);
        final Matcher m = INDEX_REFERENCE.matcher(formula);
        final StringBuilder expanded = new StringBuilder();
        while (m.find()) {
            final String sub = expand(m.group(1), path);
            m.appendReplacement(expanded, Matcher.quoteReplacement("(" + sub + ")"));
        }
        m.appendTail(expanded);
        path.removeLast();
        return expanded.toString();
    }

    private static String describe(final Deque<String> path, final String message) {
        return path.isEmpty() ? message : message + " (referenced via " + String.join(" -> ", path) + ")";
    }
}
