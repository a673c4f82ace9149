package com.scholary.consult.scribe.recognition;

/**
 * Segment audio ready to send: raw PCM16LE mono samples.
 *
 * @param pcm samples after any calibration lead-in was consumed
 * @param sampleRate sample rate of {@code pcm}
 * @param readLevel name of the read strategy that produced it
 * @param energyThreshold ambient energy threshold measured during calibration, or {@code -1} when
 *     the level skips calibration
 */
public record PreparedAudio(byte[] pcm, int sampleRate, String readLevel, double energyThreshold) {

  public boolean calibrated() {
    return energyThreshold >= 0;
  }
}
