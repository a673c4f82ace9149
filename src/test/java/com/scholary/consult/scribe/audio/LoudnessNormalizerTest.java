package com.scholary.consult.scribe.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.consult.scribe.TestAudio;
import org.junit.jupiter.api.Test;

class LoudnessNormalizerTest {

  @Test
  void normalize_shouldRaisePeakToJustBelowFullScale() {
    byte[] quiet = TestAudio.tone(200, 1000);

    byte[] loud = LoudnessNormalizer.normalize(quiet);

    int expected = (int) Math.round(Short.MAX_VALUE * Math.pow(10, -0.1 / 20));
    assertThat(LoudnessNormalizer.peakAmplitude(loud)).isBetween(expected - 1, expected);
    assertThat(loud).hasSameSizeAs(quiet);
  }

  @Test
  void normalize_shouldNotModifyInput() {
    byte[] quiet = TestAudio.tone(50, 1000);
    byte[] copy = quiet.clone();

    LoudnessNormalizer.normalize(quiet);

    assertThat(quiet).isEqualTo(copy);
  }

  @Test
  void normalize_shouldLeaveSilenceUnchanged() {
    byte[] silence = TestAudio.silence(100);

    assertThat(LoudnessNormalizer.normalize(silence)).isEqualTo(silence);
  }

  @Test
  void rms_shouldMatchSineAmplitude() {
    byte[] tone = TestAudio.tone(1000, 10_000);

    // RMS of a sine is its peak over sqrt(2)
    assertThat(LoudnessNormalizer.rms(tone, 0, tone.length))
        .isCloseTo(10_000 / Math.sqrt(2), within(50.0));
  }

  @Test
  void rms_shouldBeZeroForEmptyWindow() {
    assertThat(LoudnessNormalizer.rms(new byte[10], 10, 10)).isZero();
  }
}
