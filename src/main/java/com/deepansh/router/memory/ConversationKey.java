package com.deepansh.router.memory;

/**
 * Identity of one conversation history: the (user, session, responder) triple.
 * Compared field by field, so ids may contain any character.
 */
public record ConversationKey(String userId, String sessionId, String responderId) {

    public boolean inSession(String userId, String sessionId) {
        return this.userId.equals(userId) && this.sessionId.equals(sessionId);
    }

    /**
     * Joins ids into one flat key, each prefixed with its length ("5:alice:2:s1"),
     * so no two distinct id tuples share a key whatever characters they contain.
     */
    static String encode(String... ids) {
        StringBuilder sb = new StringBuilder();
        for (String id : ids) {
            if (sb.length() > 0) {
                sb.append(':');
            }
            sb.append(id.length()).append(':').append(id);
        }
        return sb.toString();
    }
}
