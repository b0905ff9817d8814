package com.phillippitts.interviewcopilot.protocol;

import com.phillippitts.interviewcopilot.domain.AudioChunk;
import com.phillippitts.interviewcopilot.exception.InvalidAudioFrameException;
import com.phillippitts.interviewcopilot.service.audio.AudioFormat;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary frame layout for audio chunks (all fields little-endian):
 *
 * <pre>
 * offset size field
 *      0    2 magic 0x4143
 *      2    1 version (1)
 *      3    1 format code (1 = PCM S16LE mono)
 *      4    8 sequence number
 *     12    4 sample rate (Hz)
 *     16    8 capture timestamp (epoch millis)
 *     24    n PCM payload
 * </pre>
 *
 * <p>Stateless and thread-safe.
 */
public final class AudioFrameCodec {

    public static final short MAGIC = 0x4143;
    public static final byte VERSION = 1;
    public static final int HEADER_SIZE = 24;

    private AudioFrameCodec() {
        // Utility class - prevent instantiation
    }

    public static ByteBuffer encode(AudioChunk chunk) {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE + chunk.pcm().length).order(ByteOrder.LITTLE_ENDIAN);
        buf.putShort(MAGIC);
        buf.put(VERSION);
        buf.put(AudioFormat.FORMAT_PCM_S16LE_MONO);
        buf.putLong(chunk.sequence());
        buf.putInt(chunk.sampleRate());
        buf.putLong(chunk.capturedAtMillis());
        buf.put(chunk.pcm());
        buf.flip();
        return buf;
    }

    /**
     * Decodes a frame. The buffer position is consumed; the PCM payload is copied out.
     *
     * @throws InvalidAudioFrameException on a short frame, wrong magic, unsupported version or
     *         format, non-positive sample rate, or odd payload length
     */
    public static AudioChunk decode(ByteBuffer frame) {
        int size = frame.remaining();
        if (size < HEADER_SIZE) {
            throw new InvalidAudioFrameException(size, "frame shorter than header");
        }
        ByteBuffer buf = frame.slice().order(ByteOrder.LITTLE_ENDIAN);
        if (buf.getShort() != MAGIC) {
            throw new InvalidAudioFrameException(size, "bad magic");
        }
        byte version = buf.get();
        if (version != VERSION) {
            throw new InvalidAudioFrameException(size, "unsupported version " + version);
        }
        byte format = buf.get();
        if (format != AudioFormat.FORMAT_PCM_S16LE_MONO) {
            throw new InvalidAudioFrameException(size, "unsupported format code " + format);
        }
        long sequence = buf.getLong();
        int sampleRate = buf.getInt();
        long capturedAt = buf.getLong();
        if (sequence < 0 || sampleRate <= 0) {
            throw new InvalidAudioFrameException(size, "invalid sequence or sample rate");
        }
        byte[] pcm = new byte[buf.remaining()];
        if (pcm.length % AudioFormat.REQUIRED_BLOCK_ALIGN != 0) {
            throw new InvalidAudioFrameException(size, "PCM payload not aligned to 16-bit samples");
        }
        buf.get(pcm);
        frame.position(frame.limit());
        return new AudioChunk(sequence, capturedAt, sampleRate, pcm);
    }
}
