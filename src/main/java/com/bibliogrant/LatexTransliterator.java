package com.bibliogrant;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the LaTeX fragments found in BibTeX field values into plain Unicode text.
 *
 * <p>Only a finite set of macros is understood:
 * <ul>
 *   <li>quote and dash ligatures ({@code ``}, {@code ''}, {@code \textendash}, ...)</li>
 *   <li>escaped punctuation ({@code \&}, {@code \%}, {@code \_}, {@code \#})</li>
 *   <li>accent commands such as {@code \'e}, {@code \"{o}}, {@code \v{c}} or {@code \'{\i}}</li>
 *   <li>Greek letter macros ({@code \alpha}, {@code \varphi}, {@code \Omega}, ...)</li>
 * </ul>
 * Anything else is passed through, minus the {@code $ { }} delimiters which are always stripped.
 *
 * <p>The passes run in a fixed order: accents are decoded after the literal substitutions and
 * before the braces are removed, so {@code \'{e}} still sees its argument.
 */
public final class LatexTransliterator {

    private LatexTransliterator() {
    }

    private static final Map<String, String> SIMPLE = new LinkedHashMap<>();

    static {
        SIMPLE.put("\\textquoteright", "’");
        SIMPLE.put("\\textquoteleft", "‘");
        SIMPLE.put("\\textendash", "–");
        SIMPLE.put("\\textemdash", "—");
        SIMPLE.put("\\textquotesingle", "’");
        SIMPLE.put("``", "“");
        SIMPLE.put("''", "”");
        SIMPLE.put("\\/", "");            // italic correction
        SIMPLE.put("\\ensuremath", "");
        SIMPLE.put("\\&", "&");
        SIMPLE.put("\\%", "%");
        SIMPLE.put("\\_", "_");
        SIMPLE.put("\\#", "#");
    }

    private static final Map<Character, Map<String, String>> ACCENTS = new LinkedHashMap<>();

    static {
        ACCENTS.put('\'', letters("aeiouyAEIOUY", "áéíóúýÁÉÍÓÚÝ"));   // acute
        ACCENTS.put('`', letters("aeiouAEIOU", "àèìòùÀÈÌÒÙ"));         // grave
        ACCENTS.put('^', letters("aeiouAEIOU", "âêîôûÂÊÎÔÛ"));         // circumflex
        ACCENTS.put('"', letters("aeiouyAEIOUY", "äëïöüÿÄËÏÖÜŸ"));     // umlaut
        ACCENTS.put('~', letters("aonAON", "ãõñÃÕÑ"));                 // tilde
        ACCENTS.put('c', letters("cC", "çÇ"));                         // cedilla
        ACCENTS.put('v', letters("cszCSZ", "čšžČŠŽ"));                 // caron
        ACCENTS.put('H', letters("ouOU", "őűŐŰ"));                     // double acute
        ACCENTS.put('k', letters("aeAE", "ąęĄĘ"));                     // ogonek
        ACCENTS.put('u', letters("aA", "ăĂ"));                         // breve
        ACCENTS.put('r', letters("aA", "åÅ"));                         // ring
        ACCENTS.put('=', letters("aeiouAEIOU", "āēīōūĀĒĪŌŪ"));         // macron
        ACCENTS.put('.', letters("zZ", "żŻ"));                         // dot above
    }

    private static final Map<String, String> DOTLESS = Map.of(
            "\\i", "ı",
            "\\j", "ȷ"
    );

    private static final Map<String, String> GREEK = new LinkedHashMap<>();

    static {
        greek("alpha", "α", "beta", "β", "gamma", "γ", "delta", "δ",
                "epsilon", "ε", "varepsilon", "ε", "zeta", "ζ", "eta", "η",
                "theta", "θ", "vartheta", "ϑ", "iota", "ι", "kappa", "κ",
                "lambda", "λ", "mu", "μ", "nu", "ν", "xi", "ξ",
                "pi", "π", "varpi", "ϖ", "rho", "ρ", "varrho", "ϱ",
                "sigma", "σ", "varsigma", "ς", "tau", "τ", "upsilon", "υ",
                "phi", "φ", "varphi", "ϕ", "chi", "χ", "psi", "ψ", "omega", "ω",
                "Gamma", "Γ", "Delta", "Δ", "Theta", "Θ", "Lambda", "Λ",
                "Xi", "Ξ", "Pi", "Π", "Sigma", "Σ", "Upsilon", "Υ",
                "Phi", "Φ", "Psi", "Ψ", "Omega", "Ω");
    }

    /*
     * Any braces between the accent and its letter are skipped, so \'{}e and \'{{e}} decode
     * the same as \'e. Letter accents (H k v u r c) also need the letter to end the word,
     * otherwise \varepsilon would read as a caron on "a" followed by "repsilon".
     */
    private static final Pattern ACCENT_COMMAND = Pattern.compile(
            "\\\\(?:([\\x27\"`^~=.])[{}]*(\\\\[ij]|[A-Za-z])"
                    + "|([Hkvurc])[{}]*(\\\\[ij]|[A-Za-z])(?![A-Za-z]))");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Transliterates a LaTeX fragment. Returns an empty string for null input and never throws.
     */
    public static String transliterate(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String s = text;
        for (Map.Entry<String, String> e : SIMPLE.entrySet()) {
            s = s.replace(e.getKey(), e.getValue());
        }

        s = ACCENT_COMMAND.matcher(s).replaceAll(m -> Matcher.quoteReplacement(decodeAccent(m)));

        for (Map.Entry<String, String> e : GREEK.entrySet()) {
            s = s.replace(e.getKey(), e.getValue());
        }

        s = s.replace("$", "").replace("{", "").replace("}", "");
        return WHITESPACE.matcher(s).replaceAll(" ").strip();
    }

    /**
     * Read-only view of the accent table, keyed by accent command character and base letter.
     */
    static Map<Character, Map<String, String>> accentTable() {
        return Collections.unmodifiableMap(ACCENTS);
    }

    /**
     * Read-only view of the Greek macro table.
     */
    static Map<String, String> greekTable() {
        return Collections.unmodifiableMap(GREEK);
    }

    private static String decodeAccent(MatchResult m) {
        char accent;
        String base;
        if (m.group(1) != null) {
            accent = m.group(1).charAt(0);
            base = m.group(2);
        } else {
            accent = m.group(3).charAt(0);
            base = m.group(4);
        }

        Map<String, String> table = ACCENTS.getOrDefault(accent, Map.of());
        if (DOTLESS.containsKey(base)) {
            // \'{\i} is the usual spelling of í
            String dotted = base.substring(1);
            return table.getOrDefault(dotted, DOTLESS.get(base));
        }
        return table.getOrDefault(base, base);
    }

    private static Map<String, String> letters(String bases, String accented) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < bases.length(); i++) {
            map.put(String.valueOf(bases.charAt(i)), String.valueOf(accented.charAt(i)));
        }
        return Collections.unmodifiableMap(map);
    }

    private static void greek(String... namesAndLetters) {
        for (int i = 0; i + 1 < namesAndLetters.length; i += 2) {
            GREEK.put("\\" + namesAndLetters[i], namesAndLetters[i + 1]);
        }
    }
}
