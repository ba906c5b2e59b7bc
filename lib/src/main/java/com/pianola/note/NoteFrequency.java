package com.pianola.note;

/**
 * Equal-temperament pitch of a key number.
 */
public final class NoteFrequency {

    /** Key number of concert A (A4). */
    public static final int A4_KEY = 69;

    /** Pitch of concert A in hertz. */
    public static final double A4_HZ = 440.0;

    private static final double SEMITONES_PER_OCTAVE = 12.0;

    private NoteFrequency() {
        throw new AssertionError("No instances");
    }

    /**
     * Returns {@code 440 * 2^((keyNumber - 69) / 12)}.
     *
     * @param keyNumber the key number
     * @return the frequency in hertz
     */
    public static double hz(int keyNumber) {
        return A4_HZ * Math.pow(2.0, (keyNumber - A4_KEY) / SEMITONES_PER_OCTAVE);
    }
}
