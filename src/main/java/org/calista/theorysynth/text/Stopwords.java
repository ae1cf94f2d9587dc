package org.calista.theorysynth.text;

import java.util.Arrays;
import java.util.Set;

/**
 * Fixed Portuguese + English stopword set (lowercase, accents kept).
 */
public final class Stopwords {
    private Stopwords() {}

    // pt and en lists overlap ("as", "me", "no"); copyOf tolerates duplicates
    private static final Set<String> WORDS = Set.copyOf(Arrays.asList(
            // pt
            "a", "à", "ao", "aos", "aquela", "aquelas", "aquele", "aqueles", "aquilo", "as", "às", "até",
            "com", "como", "da", "das", "de", "dela", "delas", "dele", "deles", "depois", "do", "dos",
            "e", "é", "ela", "elas", "ele", "eles", "em", "entre", "era", "eram", "essa", "essas", "esse",
            "esses", "esta", "está", "estão", "estas", "este", "estes", "eu", "foi", "foram", "há", "isso",
            "isto", "já", "lhe", "lhes", "mais", "mas", "me", "mesmo", "meu", "minha", "muito", "na", "nas",
            "nem", "no", "nos", "nós", "não", "num", "numa", "o", "os", "ou", "para", "pela", "pelas",
            "pelo", "pelos", "por", "qual", "quando", "que", "quem", "se", "sem", "ser", "seu", "seus",
            "só", "sua", "suas", "são", "também", "te", "tem", "têm", "um", "uma", "umas", "uns", "você",
            "vocês", "sobre", "onde", "cada", "pode", "podem", "ainda", "assim", "então", "seja", "ter",
            "sendo", "sido", "fazer", "faz", "apenas", "bem", "todo", "toda", "todos", "todas", "outro",
            "outra", "outros", "outras", "seus", "suas", "nosso", "nossa", "partir", "através", "aqui",
            // en
            "about", "after", "all", "also", "an", "and", "any", "are", "as", "at", "be", "because",
            "been", "before", "being", "between", "both", "but", "by", "can", "could", "did", "do",
            "does", "doing", "each", "for", "from", "had", "has", "have", "having", "he", "her", "here",
            "hers", "him", "his", "how", "i", "if", "in", "into", "is", "it", "its", "itself", "just",
            "me", "more", "most", "my", "no", "nor", "not", "of", "off", "on", "once", "only", "or",
            "other", "our", "ours", "out", "over", "own", "same", "she", "should", "so", "some", "such",
            "than", "that", "the", "their", "theirs", "them", "then", "there", "these", "they", "this",
            "those", "through", "to", "too", "under", "until", "up", "very", "was", "we", "were", "what",
            "when", "where", "which", "while", "who", "whom", "why", "will", "with", "would", "you",
            "your", "yours", "may", "might", "must", "shall", "upon", "via", "within", "without"
    ));

    public static boolean isStopword(String lowercaseToken) {
        return lowercaseToken != null && WORDS.contains(lowercaseToken);
    }

    public static int size() {
        return WORDS.size();
    }
}
