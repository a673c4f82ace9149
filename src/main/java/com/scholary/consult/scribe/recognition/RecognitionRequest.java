package com.scholary.consult.scribe.recognition;

/** Audio submitted to the recognition service: raw PCM16LE mono samples and their rate. */
public record RecognitionRequest(byte[] pcm, int sampleRate, String locale) {}
