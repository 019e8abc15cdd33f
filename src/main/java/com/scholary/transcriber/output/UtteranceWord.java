package com.scholary.transcriber.output;

/** A timed word inside an utterance. Times rounded to milliseconds, confidence to 4 decimals. */
public record UtteranceWord(String word, double start, double end, double confidence) {}
