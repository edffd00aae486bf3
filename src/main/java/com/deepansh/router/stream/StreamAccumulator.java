package com.deepansh.router.stream;

/**
 * Joins forwarded fragments so the complete reply can be persisted once the stream ends.
 * One accumulator per relay subscription; Reactor serializes the signals that reach it.
 */
public class StreamAccumulator {

    private final StringBuilder buffer = new StringBuilder();
    private int fragmentCount;

    public void append(String fragment) {
        buffer.append(fragment);
        fragmentCount++;
    }

    public String getAccumulated() {
        return buffer.toString();
    }

    public int getFragmentCount() {
        return fragmentCount;
    }

    public boolean isEmpty() {
        return buffer.length() == 0;
    }
}
