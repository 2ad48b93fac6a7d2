package com.archintent.resolver.service;

import com.archintent.resolver.model.Ontology;
import com.archintent.resolver.model.Tag;
import com.archintent.resolver.model.TagKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts business entities, actions and qualifiers from free text by greedy longest-match
 * against the ontology vocabulary. Qualifiers attach to the nearest entity by adjacency; there
 * is no grammar.
 */
@Service
public class TaggerService {

    private static final Logger logger = LoggerFactory.getLogger(TaggerService.class);

    private final Ontology ontology;
    private final Set<String> knownWords;
    private final int longestPhrase;

    public TaggerService(Ontology ontology) {
        this.ontology = ontology;
        Set<String> words = new HashSet<>();
        int longest = 1;
        for (String phrase : ontology.vocabulary()) {
            String[] parts = phrase.split(" ");
            longest = Math.max(longest, parts.length);
            for (String part : parts) {
                words.add(part);
            }
        }
        this.knownWords = words;
        this.longestPhrase = longest;
    }

    public List<Tag> tag(String text) {
        if (!StringUtils.hasText(text)) {
            return List.of();
        }
        List<Terms.Token> tokens = Terms.tokens(text);
        List<String> normalized = new ArrayList<>(tokens.size());
        for (Terms.Token token : tokens) {
            normalized.add(Terms.normalizeWord(token.word(), knownWords));
        }

        List<Tag> tags = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            int matchedLength = 0;
            for (int n = Math.min(longestPhrase, tokens.size() - i); n >= 1; n--) {
                String phrase = String.join(" ", normalized.subList(i, i + n));
                if (ontology.vocabulary().contains(phrase)) {
                    int start = tokens.get(i).start();
                    int end = tokens.get(i + n - 1).end();
                    tags.add(new Tag(text.substring(start, end), start, end, kindOf(phrase), phrase, i, null));
                    matchedLength = n;
                    break;
                }
            }
            i += matchedLength > 0 ? matchedLength : 1;
        }

        List<Tag> attached = attachQualifiers(tags);
        logger.debug("Tagged {} term(s) in request: {}", attached.size(), attached);
        return attached;
    }

    private TagKind kindOf(String phrase) {
        if (ontology.lexicon().isAction(phrase)) {
            return TagKind.ACTION;
        }
        if (ontology.lexicon().isQualifier(phrase)) {
            return TagKind.QUALIFIER;
        }
        return TagKind.ENTITY;
    }

    /**
     * On equal distance the following entity wins, since English modifiers usually precede the noun.
     */
    private List<Tag> attachQualifiers(List<Tag> tags) {
        List<Tag> result = new ArrayList<>(tags.size());
        for (Tag tag : tags) {
            if (tag.kind() != TagKind.QUALIFIER) {
                result.add(tag);
                continue;
            }
            Tag nearest = null;
            int bestDistance = Integer.MAX_VALUE;
            for (Tag candidate : tags) {
                if (candidate.kind() != TagKind.ENTITY) {
                    continue;
                }
                int distance = Math.abs(candidate.position() - tag.position());
                boolean following = candidate.position() > tag.position();
                if (distance < bestDistance || (distance == bestDistance && following)) {
                    nearest = candidate;
                    bestDistance = distance;
                }
            }
            result.add(nearest == null ? tag : tag.attachTo(nearest.term()));
        }
        return List.copyOf(result);
    }
}
