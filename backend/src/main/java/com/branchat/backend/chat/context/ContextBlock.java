package com.branchat.backend.chat.context;

/** A rendered system block and the number of sources it summarises. */
public record ContextBlock(String content, int sourceCount) {}
