package com.archintent.resolver.model;

/**
 * A recognized business term in the request text.
 *
 * @param text       the span as written in the input
 * @param start      character offset of the span (inclusive)
 * @param end        character offset of the span (exclusive)
 * @param kind       entity, action or qualifier
 * @param term       normalized vocabulary phrase
 * @param position   token index of the first word of the span
 * @param attachedTo for qualifiers, the normalized term of the nearest entity; otherwise null
 */
public record Tag(
        String text,
        int start,
        int end,
        TagKind kind,
        String term,
        int position,
        String attachedTo
) {
    public Tag attachTo(String entityTerm) {
        return new Tag(text, start, end, kind, term, position, entityTerm);
    }
}
