package com.phillippitts.interviewcopilot.protocol;

import com.phillippitts.interviewcopilot.domain.AudioChunk;
import com.phillippitts.interviewcopilot.exception.InvalidAudioFrameException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioFrameCodecTest {

    private static final byte[] PCM = {1, 0, 2, 0, -1, -1, 0, 127};

    @Test
    void headerIsLittleEndianAndPayloadFollows() {
        ByteBuffer frame = AudioFrameCodec.encode(new AudioChunk(7, 1_700_000_000_000L, 16_000, PCM));

        assertThat(frame.remaining()).isEqualTo(AudioFrameCodec.HEADER_SIZE + PCM.length);
        assertThat(frame.get(0)).isEqualTo((byte) 0x43);
        assertThat(frame.get(1)).isEqualTo((byte) 0x41);
        assertThat(frame.get(2)).isEqualTo(AudioFrameCodec.VERSION);
        assertThat(frame.get(4)).isEqualTo((byte) 7);
        assertThat(frame.get(AudioFrameCodec.HEADER_SIZE + 7)).isEqualTo((byte) 127);
    }

    @Test
    void decodeRestoresChunkAndConsumesBuffer() {
        ByteBuffer frame = AudioFrameCodec.encode(new AudioChunk(42, 123L, 16_000, PCM));

        AudioChunk chunk = AudioFrameCodec.decode(frame);

        assertThat(chunk.sequence()).isEqualTo(42);
        assertThat(chunk.capturedAtMillis()).isEqualTo(123L);
        assertThat(chunk.sampleRate()).isEqualTo(16_000);
        assertThat(chunk.pcm()).containsExactly(PCM);
        assertThat(frame.hasRemaining()).isFalse();
    }

    @Test
    void emptyPayloadIsValid() {
        AudioChunk chunk = AudioFrameCodec.decode(AudioFrameCodec.encode(new AudioChunk(0, 0, 16_000, new byte[0])));

        assertThat(chunk.pcm()).isEmpty();
    }

    @Test
    void rejectsShortFrame() {
        assertThatThrownBy(() -> AudioFrameCodec.decode(ByteBuffer.allocate(10)))
                .isInstanceOf(InvalidAudioFrameException.class)
                .hasMessageContaining("shorter than header");
    }

    @Test
    void rejectsBadMagic() {
        ByteBuffer frame = AudioFrameCodec.encode(new AudioChunk(0, 0, 16_000, PCM));
        frame.put(0, (byte) 0);

        assertThatThrownBy(() -> AudioFrameCodec.decode(frame))
                .isInstanceOf(InvalidAudioFrameException.class)
                .hasMessageContaining("bad magic");
    }

    @Test
    void rejectsUnsupportedVersionAndFormat() {
        ByteBuffer badVersion = AudioFrameCodec.encode(new AudioChunk(0, 0, 16_000, PCM));
        badVersion.put(2, (byte) 2);
        ByteBuffer badFormat = AudioFrameCodec.encode(new AudioChunk(0, 0, 16_000, PCM));
        badFormat.put(3, (byte) 9);

        assertThatThrownBy(() -> AudioFrameCodec.decode(badVersion)).hasMessageContaining("unsupported version 2");
        assertThatThrownBy(() -> AudioFrameCodec.decode(badFormat)).hasMessageContaining("unsupported format code 9");
    }

    @Test
    void rejectsOddPayloadAndZeroSampleRate() {
        ByteBuffer odd = AudioFrameCodec.encode(new AudioChunk(0, 0, 16_000, new byte[]{1, 2, 3}));
        ByteBuffer zeroRate = AudioFrameCodec.encode(new AudioChunk(0, 0, 16_000, PCM)).order(ByteOrder.LITTLE_ENDIAN);
        zeroRate.putInt(12, 0);

        assertThatThrownBy(() -> AudioFrameCodec.decode(odd))
                .isInstanceOf(InvalidAudioFrameException.class)
                .satisfies(e -> assertThat(((InvalidAudioFrameException) e).getFrameSize())
                        .isEqualTo(AudioFrameCodec.HEADER_SIZE + 3));
        assertThatThrownBy(() -> AudioFrameCodec.decode(zeroRate)).isInstanceOf(InvalidAudioFrameException.class);
    }
}
