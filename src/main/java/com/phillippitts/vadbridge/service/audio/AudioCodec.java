package com.phillippitts.vadbridge.service.audio;

/**
 * Stateless float32 ⇄ PCM16 conversion used at the boundary and for speech-end payloads.
 *
 * <p>Conversion rules:
 * <ul>
 *   <li>float → PCM16: clamp to [-1.0, 1.0], multiply by {@value #PCM16_SCALE}, truncate toward
 *       zero. NaN converts to 0.</li>
 *   <li>PCM16 → float: divide by {@value #PCM16_DIVISOR}.</li>
 * </ul>
 *
 * <p>Java float arithmetic is strict, so results are bit-identical on every platform.
 * The array-to-array variants allocate nothing.
 */
public final class AudioCodec {

    /** Scale applied to clamped float samples. */
    public static final float PCM16_SCALE = 32767.0f;

    /** Divisor applied to PCM16 samples. */
    public static final float PCM16_DIVISOR = 32768.0f;

    private AudioCodec() {}

    /**
     * Converts float samples into a caller-provided PCM16 buffer.
     *
     * @param in float samples, nominally in [-1.0, 1.0]
     * @param out destination, at least {@code in.length} long
     * @throws IllegalArgumentException if either buffer is null or {@code out} is too short
     */
    public static void floatToPcm16(float[] in, short[] out) {
        requireBuffers(in, out, in == null ? 0 : in.length, out == null ? 0 : out.length);
        floatToPcm16(in, 0, out, 0, in.length);
    }

    /**
     * Converts {@code count} float samples starting at {@code inOffset} into {@code out}.
     */
    public static void floatToPcm16(float[] in, int inOffset, short[] out, int outOffset, int count) {
        checkRange(in == null ? -1 : in.length, inOffset, count, "in");
        checkRange(out == null ? -1 : out.length, outOffset, count, "out");
        for (int i = 0; i < count; i++) {
            out[outOffset + i] = toPcm16(in[inOffset + i]);
        }
    }

    /**
     * Converts float samples into a freshly allocated PCM16 array.
     */
    public static short[] floatToPcm16(float[] in) {
        if (in == null) {
            throw new IllegalArgumentException("in must not be null");
        }
        short[] out = new short[in.length];
        floatToPcm16(in, 0, out, 0, in.length);
        return out;
    }

    /**
     * Converts PCM16 samples into a caller-provided float buffer.
     *
     * @param in PCM16 samples
     * @param out destination, at least {@code in.length} long
     * @throws IllegalArgumentException if either buffer is null or {@code out} is too short
     */
    public static void pcm16ToFloat(short[] in, float[] out) {
        requireBuffers(in, out, in == null ? 0 : in.length, out == null ? 0 : out.length);
        pcm16ToFloat(in, 0, out, 0, in.length);
    }

    public static void pcm16ToFloat(short[] in, int inOffset, float[] out, int outOffset, int count) {
        checkRange(in == null ? -1 : in.length, inOffset, count, "in");
        checkRange(out == null ? -1 : out.length, outOffset, count, "out");
        for (int i = 0; i < count; i++) {
            out[outOffset + i] = in[inOffset + i] / PCM16_DIVISOR;
        }
    }

    /**
     * Converts a single float sample to PCM16.
     */
    public static short toPcm16(float sample) {
        float clamped = sample;
        if (clamped > 1.0f) {
            clamped = 1.0f;
        }
        if (clamped < -1.0f) {
            clamped = -1.0f;
        }
        // (int) truncates toward zero and maps NaN to 0
        return (short) (int) (clamped * PCM16_SCALE);
    }

    /**
     * Returns the duration of {@code sampleCount} samples in whole milliseconds (truncated).
     *
     * @param sampleCount number of mono samples
     * @param sampleRate sample rate in Hz (must be positive)
     * @return duration in milliseconds
     */
    public static int durationMillis(int sampleCount, int sampleRate) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        return (int) ((double) sampleCount / sampleRate * 1000);
    }

    private static void requireBuffers(Object in, Object out, int inLength, int outLength) {
        if (in == null || out == null) {
            throw new IllegalArgumentException("in and out buffers must not be null");
        }
        if (outLength < inLength) {
            throw new IllegalArgumentException(
                    "out buffer too short: " + outLength + " < " + inLength);
        }
    }

    private static void checkRange(int length, int offset, int count, String name) {
        if (length < 0) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        if (offset < 0 || count < 0 || offset > length - count) {
            throw new IllegalArgumentException(
                    name + " range out of bounds: offset=" + offset + ", count=" + count + ", length=" + length);
        }
    }
}
