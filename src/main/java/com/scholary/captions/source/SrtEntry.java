package com.scholary.captions.source;

/**
 * One SRT block.
 *
 * @param index sequence number as written in the file
 * @param start start time in seconds
 * @param end end time in seconds
 * @param text subtitle text, may span several lines
 */
public record SrtEntry(int index, double start, double end, String text) {}
