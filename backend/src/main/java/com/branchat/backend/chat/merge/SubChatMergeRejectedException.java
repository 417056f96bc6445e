package com.branchat.backend.chat.merge;

import java.util.Objects;
import java.util.UUID;

public class SubChatMergeRejectedException extends RuntimeException {

  private final MergeRejection code;
  private final UUID subChatId;

  public SubChatMergeRejectedException(MergeRejection code, UUID subChatId) {
    super(Objects.requireNonNull(code, "code must not be null").message() + ": " + subChatId);
    this.code = code;
    this.subChatId = subChatId;
  }

  public MergeRejection getCode() {
    return code;
  }

  public UUID getSubChatId() {
    return subChatId;
  }
}
