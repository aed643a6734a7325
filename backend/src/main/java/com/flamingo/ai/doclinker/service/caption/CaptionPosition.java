package com.flamingo.ai.doclinker.service.caption;

/** Where a caption sits relative to its figure, in search priority order. */
public enum CaptionPosition {
  BELOW,
  ABOVE,
  RIGHT
}
