package org.calista.theorysynth.synth;

import org.calista.theorysynth.model.Formula;
import org.calista.theorysynth.model.ParameterEntry;
import org.calista.theorysynth.model.SystemModel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ParameterTableBuilder: glossary of every symbol used by formulas and models.
 *
 * Scans formula expressions, then governing equations, for identifier tokens in
 * first-appearance order. Concept symbols and catalog-declared symbols become entries;
 * anything else (t, i, j, dt, log...) is skipped. Labels are deduplicated by exact match,
 * and every label is an identifier that occurs literally in the scanned text.
 */
public final class ParameterTableBuilder {

    static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{Nd}_]*");

    public List<ParameterEntry> build(List<Formula> formulas, List<SystemModel> models, List<Concept> concepts) {
        Map<String, Concept> bySymbol = new HashMap<>();
        if (concepts != null) {
            for (Concept c : concepts) bySymbol.putIfAbsent(c.symbol(), c);
        }

        LinkedHashMap<String, String> table = new LinkedHashMap<>();
        if (formulas != null) {
            for (Formula f : formulas) scan(f.expression, bySymbol, table);
        }
        if (models != null) {
            for (SystemModel m : models) scan(m.governingEquation, bySymbol, table);
        }

        ArrayList<ParameterEntry> out = new ArrayList<>(table.size());
        for (Map.Entry<String, String> e : table.entrySet()) {
            out.add(new ParameterEntry(e.getKey(), e.getValue()));
        }
        return out;
    }

    private static void scan(String text, Map<String, Concept> bySymbol, Map<String, String> table) {
        if (text == null || text.isEmpty()) return;
        Matcher m = IDENTIFIER.matcher(text);
        while (m.find()) {
            String id = m.group();
            if (table.containsKey(id)) continue;

            Concept c = bySymbol.get(id);
            if (c != null) {
                table.put(id, String.format(Locale.ROOT, Glossary.CONCEPT_VARIABLE, c.term));
                continue;
            }
            String declared = Glossary.describe(id);
            if (declared != null) table.put(id, declared);
        }
    }
}
