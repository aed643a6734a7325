package com.flamingo.ai.doclinker.domain.model;

/** Rendered page dimensions in the same units as the bounding boxes. */
public record PageSize(double width, double height) {}
