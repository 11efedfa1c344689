package com.flamingo.ai.searchablepdf.service.textlayer.model;

/** Which rectangle of a page the OCR pixel space is mapped onto. */
public enum AnchorMode {
  /** The page's crop box, i.e. the visible page area. */
  CROP_BOX,

  /** The placement of the first image the page draws, falling back to the crop box. */
  SCANNED_IMAGE
}
