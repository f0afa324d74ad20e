package dev.quarry.pipeline;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Stop-word lists shared by language detection, keyword extraction and token reduction.
 * Languages are keyed by ISO 639-1 code; three-letter codes and English names are accepted too.
 */
final class StopWords {
    static final String DEFAULT_LANGUAGE = "en";

    private static final Map<String, Set<String>> LISTS = new HashMap<>();
    private static final Map<String, String> ALIASES = new HashMap<>();

    static {
        add("en", "eng", "english",
            "the and of to a in is it that for on was with as are be this by at from or an have not"
                + " but had his they you which were her she he we there been has their would will can all"
                + " its if so what when out up about who them do no into than more some could then my"
                + " other these our only also any may such those how over i me your him after");
        add("de", "deu", "german",
            "der die und in den von zu das mit sich des auf f\u00fcr ist im dem nicht ein eine als auch es"
                + " an werden aus er hat dass sie nach wird bei einer um am sind noch wie einem \u00fcber einen"
                + " so zum war haben nur oder aber vor zur bis mehr durch man sein wurde ich wir");
        add("fr", "fra", "french",
            "le la les de des et en un une du est que qui dans pour pas au sur ne se par plus il ce"
                + " avec son sa ses aux ou \u00e9t\u00e9 \u00eatre mais nous vous elle ils sont cette comme tout leur"
                + " on je lui fait bien");
        add("es", "spa", "spanish",
            "el la de que y a en un ser se no haber por con su para como estar tener le lo todo pero"
                + " m\u00e1s hacer o poder decir este ir otro ese los las del al una es son sus fue muy sin"
                + " sobre tambi\u00e9n me hasta hay donde");
        add("it", "ita", "italian",
            "il lo la i gli le di a da in con su per tra fra e che un una non \u00e8 sono del della dei"
                + " delle al alla nel nella come pi\u00f9 ma anche se si ha questo questa quello era essere"
                + " loro suo sua");
        add("pt", "por", "portuguese",
            "o a os as de do da dos das em no na nos nas um uma e que \u00e9 para com n\u00e3o por mais se ao"
                + " como mas foi ele ela seu sua ou ser quando muito h\u00e1 j\u00e1 est\u00e1 tamb\u00e9m pelo"
                + " pela at\u00e9 isso");
        add("nl", "nld", "dutch",
            "de het een en van in is dat op te zijn met voor niet aan er om ook als bij door maar"
                + " uit dan nog naar wordt of tot over hij zij ze wij je ik deze dit die was");
        add("sv", "swe", "swedish",
            "och i att det som en p\u00e5 \u00e4r av f\u00f6r med till den har de inte om ett han var jag men sig"
                + " fr\u00e5n vi s\u00e5 kan man n\u00e4r \u00e5r s\u00e4ger hon under ocks\u00e5 efter eller nu"
                + " sin d\u00e4r vid");
        add("pl", "pol", "polish",
            "i w na z do nie si\u0119 \u017ce to jest o jak a od po ale co przez dla tak czy jego jej s\u0105 by\u0142"
                + " by\u0142a by\u0142o tylko by\u0107 ju\u017c tym tak\u017ce mo\u017ce jako lub oraz");
        add("ru", "rus", "russian",
            "\u0438 \u0432 \u0432\u043e \u043d\u0435 \u0447\u0442\u043e \u043e\u043d \u043d\u0430 \u044f \u0441"
                + " \u0441\u043e \u043a\u0430\u043a \u0430 \u0442\u043e \u0432\u0441\u0435 \u043e\u043d\u0430"
                + " \u0442\u0430\u043a \u0435\u0433\u043e \u043d\u043e \u0434\u0430 \u0442\u044b \u043a \u0443"
                + " \u0436\u0435 \u0432\u044b \u0437\u0430 \u0431\u044b \u043f\u043e"
                + " \u0442\u043e\u043b\u044c\u043a\u043e \u0435\u0435 \u043c\u043d\u0435 \u0431\u044b\u043b\u043e"
                + " \u0432\u043e\u0442 \u043e\u0442 \u043c\u0435\u043d\u044f \u0435\u0449\u0435"
                + " \u043d\u0435\u0442 \u043e \u0438\u0437 \u0435\u043c\u0443"
                + " \u0442\u0435\u043f\u0435\u0440\u044c \u043a\u043e\u0433\u0434\u0430 \u0434\u0430\u0436\u0435"
                + " \u043d\u0443 \u0432\u0434\u0440\u0443\u0433 \u043b\u0438 \u0435\u0441\u043b\u0438"
                + " \u0443\u0436\u0435 \u0438\u043b\u0438 \u044d\u0442\u043e \u044d\u0442\u043e\u0442"
                + " \u044d\u0442\u0430 \u0431\u044b\u0442\u044c \u0431\u044b\u043b \u0431\u044b\u043b\u0430");
    }

    private StopWords() {
    }

    private static void add(String code, String alpha3, String englishName, String words) {
        Set<String> set = new HashSet<>(List.of(words.split(" ")));
        LISTS.put(code, Collections.unmodifiableSet(set));
        ALIASES.put(alpha3, code);
        ALIASES.put(englishName, code);
    }

    /**
     * Normalize a language code.
     *
     * @param language ISO 639-1/639-3 code or English name
     * @return two-letter code, or null when no list exists for it
     */
    static String normalize(String language) {
        if (language == null) {
            return null;
        }
        String value = language.trim().toLowerCase(Locale.ROOT);
        int separator = value.indexOf('-') >= 0 ? value.indexOf('-') : value.indexOf('_');
        if (separator > 0) {
            value = value.substring(0, separator);
        }
        if (LISTS.containsKey(value)) {
            return value;
        }
        return ALIASES.get(value);
    }

    static Set<String> forLanguage(String language) {
        String code = normalize(language);
        return LISTS.getOrDefault(code != null ? code : DEFAULT_LANGUAGE, LISTS.get(DEFAULT_LANGUAGE));
    }

    static Set<String> languages() {
        return Collections.unmodifiableSet(LISTS.keySet());
    }

    static boolean isStopWord(String word, Set<String> list) {
        return list.contains(word.toLowerCase(Locale.ROOT));
    }
}
