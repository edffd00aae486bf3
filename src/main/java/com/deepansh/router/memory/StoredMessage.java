package com.deepansh.router.memory;

import com.deepansh.router.model.Message;

/** A history entry plus the time it was stored, used to merge per-responder histories. */
public record StoredMessage(Message message, long storedAt) {
}
