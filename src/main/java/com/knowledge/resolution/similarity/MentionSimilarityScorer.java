package com.knowledge.resolution.similarity;

import com.knowledge.resolution.api.EntityResolutionConfig;
import com.knowledge.resolution.core.model.EntityMention;
import com.knowledge.resolution.core.model.ResolutionMethod;
import com.knowledge.resolution.embedding.EmbeddingIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Pure predicate deciding whether two mentions name the same entity.
 *
 * <p>Signals are tried in order and the first that fires wins:</p>
 * <ol>
 *   <li><b>Exact</b>: identical text ignoring case and surrounding whitespace (score 1.0)</li>
 *   <li><b>Containment</b>: one text contains the other ignoring case, e.g. "Arsenal" in
 *       "Arsenal FC" (score {@code 0.5 + 0.5 * shorter/longer})</li>
 *   <li><b>Embedding</b>: cosine similarity of the mentions' vectors at or above
 *       {@link EntityResolutionConfig#getSimilarityThreshold()}; skipped when either vector
 *       is missing or the comparison fails</li>
 * </ol>
 *
 * <p>When {@link EntityResolutionConfig#isRequireTypeOverlap()} is set, a fired signal is
 * discarded unless the mentions share a type (see {@link TypeOverlap}). Blank texts
 * never match lexically.</p>
 */
public class MentionSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(MentionSimilarityScorer.class);

    private final EntityResolutionConfig config;
    private final EmbeddingIndex embeddings;

    public MentionSimilarityScorer(EntityResolutionConfig config) {
        this(config, EmbeddingIndex.empty());
    }

    public MentionSimilarityScorer(EntityResolutionConfig config, EmbeddingIndex embeddings) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.embeddings = embeddings != null ? embeddings : EmbeddingIndex.empty();
    }

    public boolean matches(EntityMention a, EntityMention b) {
        return score(a, b).matched();
    }

    /**
     * Compares two mentions and reports the signal that decided the outcome.
     */
    public MatchSignal score(EntityMention a, EntityMention b) {
        MatchSignal signal = detect(a, b);
        if (!signal.matched()) {
            return signal;
        }
        if (config.isRequireTypeOverlap() && !TypeOverlap.overlaps(a.getTypes(), b.getTypes())) {
            log.debug("match.rejected reason=type_gate a={} b={} method={}", a.getId(), b.getId(), signal.method());
            return signal.rejected();
        }
        return signal;
    }

    private MatchSignal detect(EntityMention a, EntityMention b) {
        String textA = normalize(a.getMention());
        String textB = normalize(b.getMention());

        if (!textA.isEmpty() && !textB.isEmpty()) {
            if (textA.equals(textB)) {
                return MatchSignal.match(ResolutionMethod.EXACT, 1.0);
            }
            if (textA.contains(textB) || textB.contains(textA)) {
                double ratio = (double) Math.min(textA.length(), textB.length())
                        / Math.max(textA.length(), textB.length());
                return MatchSignal.match(ResolutionMethod.CONTAINMENT, 0.5 + 0.5 * ratio);
            }
        }

        OptionalDouble cosine = embeddings.similarity(a.getId(), b.getId());
        if (cosine.isPresent() && cosine.getAsDouble() >= config.getSimilarityThreshold()) {
            return MatchSignal.match(ResolutionMethod.EMBEDDING, Math.min(1.0, cosine.getAsDouble()));
        }
        return MatchSignal.none();
    }

    static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    public EntityResolutionConfig getConfig() {
        return config;
    }
}
