package com.knowledge.resolution.similarity;

import com.knowledge.resolution.core.model.EntityMention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Candidate pairs restricted to mentions that share a blocking key.
 *
 * <p>An inverted index maps each key to the input positions carrying it. Keys whose
 * posting list is longer than {@code maxBlockSize} are ignored: such keys are too common
 * to discriminate and would bring back quadratic cost. Pairs are visited in ascending
 * {@code (i, j)} order so clustering stays deterministic.</p>
 *
 * <p>Blocking trades recall for speed: mentions with no significant token in common,
 * such as "AFC" and "Arsenal", are never compared, so containment or embedding matches between them are lost.</p>
 */
public class TokenBlockingPairGenerator implements CandidatePairGenerator {
    private static final Logger log = LoggerFactory.getLogger(TokenBlockingPairGenerator.class);

    private final BlockingKeyStrategy keyStrategy;
    private final int maxBlockSize;

    public TokenBlockingPairGenerator(BlockingKeyStrategy keyStrategy, int maxBlockSize) {
        this.keyStrategy = Objects.requireNonNull(keyStrategy, "keyStrategy is required");
        if (maxBlockSize <= 1) {
            throw new IllegalArgumentException("maxBlockSize must be > 1");
        }
        this.maxBlockSize = maxBlockSize;
    }

    @Override
    public void generate(List<EntityMention> mentions, PairVisitor visitor) {
        List<List<String>> keysByMention = new ArrayList<>(mentions.size());
        Map<String, List<Integer>> postings = new HashMap<>();
        for (int i = 0; i < mentions.size(); i++) {
            List<String> keys = new ArrayList<>(keyStrategy.generateKeys(mentions.get(i).getMention()));
            keysByMention.add(keys);
            for (String key : keys) {
                postings.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
            }
        }

        long visited = 0;
        int skippedKeys = 0;
        for (List<Integer> posting : postings.values()) {
            if (posting.size() > maxBlockSize) {
                skippedKeys++;
            }
        }

        for (int i = 0; i < mentions.size(); i++) {
            TreeSet<Integer> candidates = new TreeSet<>();
            for (String key : keysByMention.get(i)) {
                List<Integer> posting = postings.get(key);
                if (posting.size() > maxBlockSize) {
                    continue;
                }
                for (int j : posting) {
                    if (j > i) {
                        candidates.add(j);
                    }
                }
            }
            for (int j : candidates) {
                visitor.visit(i, j);
                visited++;
            }
        }
        log.debug("blocking.pairs mentions={} keys={} oversizedKeys={} pairs={}",
                mentions.size(), postings.size(), skippedKeys, visited);
    }
}
