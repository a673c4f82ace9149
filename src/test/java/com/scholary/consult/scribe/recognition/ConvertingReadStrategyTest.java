package com.scholary.consult.scribe.recognition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.scholary.consult.scribe.TestAudio;
import com.scholary.consult.scribe.audio.AudioNormalizer;
import com.scholary.consult.scribe.audio.DecodeException;
import com.scholary.consult.scribe.segment.Segment;
import com.scholary.consult.scribe.segment.TimeRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConvertingReadStrategyTest {

  @Mock private AudioNormalizer normalizer;

  private final Segment segment =
      new Segment("rec-1", 0, new TimeRange(0, 1000), new byte[2048], true);

  @Test
  void read_shouldNormalizeThenCalibrate() {
    when(normalizer.normalize(any())).thenReturn(TestAudio.toneWav(1500, 3000));
    ConvertingReadStrategy strategy =
        new ConvertingReadStrategy(normalizer, new AmbientNoiseCalibrator(500));

    PreparedAudio audio = strategy.read(segment);

    assertThat(audio.readLevel()).isEqualTo("converted");
    assertThat(audio.sampleRate()).isEqualTo(16_000);
    assertThat(audio.pcm()).hasSize(32_000);
    assertThat(audio.calibrated()).isTrue();
  }

  @Test
  void read_shouldWrapDecoderFailure() {
    when(normalizer.normalize(any()))
        .thenThrow(new DecodeException(DecodeException.Reason.UNREADABLE, "ffmpeg exited with 1"));
    ConvertingReadStrategy strategy =
        new ConvertingReadStrategy(normalizer, new AmbientNoiseCalibrator(500));

    assertThatThrownBy(() -> strategy.read(segment))
        .isInstanceOf(AudioReadException.class)
        .hasMessageContaining("ffmpeg exited with 1")
        .hasCauseInstanceOf(DecodeException.class);
  }
}
