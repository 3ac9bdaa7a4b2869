package ini;

import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves {@code ${key}} and {@code ${section:key}} placeholders in section values.
 * <p>
 * Resolution is plain substring substitution repeated up to {@link Ini#MAX_INTERPOLATION_DEPTH} passes.
 * Patterns are matched literally, so placeholders of different origin that spell the same text
 * (section {@code a} key {@code b:c} and section {@code a:b} key {@code c}) are indistinguishable.
 * Cycles are not detected: they stop at the pass limit and keep their placeholders.
 */
class Interpolator {

    private static final Logger log = LoggerFactory.getLogger(Interpolator.class);

    private static final String OPEN = "${";
    private static final String CLOSE = "}";
    private static final char SEPARATOR = ':';

    private final Map<String, Map<String, String>> sections;

    Interpolator(@NonNull Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    /**
     * @return number of global passes that ran
     */
    int interpolate() {
        for (Map.Entry<String, Map<String, String>> sec : sections.entrySet()) {
            replaceSymbols(localSymbols(sec.getKey(), sec.getValue()), sec.getValue());
        }

        int passes = 0;
        boolean changed;
        do {
            changed = false;
            List<Symbol> symbols = globalSymbols();
            for (Map<String, String> section : sections.values()) {
                changed |= replaceSymbols(symbols, section);
            }
            passes++;
        } while (changed && passes < Ini.MAX_INTERPOLATION_DEPTH);

        if (changed) {
            log.warn("Interpolation stopped after {} passes with unresolved references", passes);
        } else {
            log.debug("Interpolation stabilized after {} passes", passes);
        }
        return passes;
    }

    static String localSymbol(String name) {
        return OPEN + name + CLOSE;
    }

    static String globalSymbol(String section, String name) {
        return localSymbol(section + SEPARATOR + name);
    }

    private static List<Symbol> localSymbols(String sectionName, Map<String, String> section) {
        List<Symbol> result = new ArrayList<>(section.size());
        for (String key : section.keySet()) {
            result.add(new Symbol(localSymbol(key), globalSymbol(sectionName, key)));
        }
        return result;
    }

    private List<Symbol> globalSymbols() {
        List<Symbol> result = new ArrayList<>();
        for (Map.Entry<String, Map<String, String>> sec : sections.entrySet()) {
            for (Map.Entry<String, String> val : sec.getValue().entrySet()) {
                result.add(new Symbol(globalSymbol(sec.getKey(), val.getKey()), val.getValue()));
            }
        }
        return result;
    }

    private static boolean replaceSymbols(List<Symbol> symbols, Map<String, String> section) {
        boolean changed = false;
        for (Symbol sym : symbols) {
            for (Map.Entry<String, String> val : section.entrySet()) {
                String replaced = IniText.replaceAll(val.getValue(), sym.getPattern(), sym.getReplacement());
                if (replaced != null) {
                    val.setValue(replaced);
                    changed = true;
                }
            }
        }
        return changed;
    }
}
