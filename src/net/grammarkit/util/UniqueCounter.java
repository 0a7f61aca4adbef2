package net.grammarkit.util;

public class UniqueCounter {

    public static final UniqueCounter INSTANCE = new UniqueCounter();

    private long lastTime;
    private int sequence;

    /**
     * Output format: a long, with the upper 54 bits containing a
     * millisecond-precise UNIX timestamp, and the remaining bits
     * containing a sequence number within that millisecond.
     * Values are strictly increasing; when the sequence overflows, the
     * timestamp part runs ahead of the clock until the clock catches up.
     */
    public synchronized long get() {
        long curTime = System.currentTimeMillis();
        if (curTime > lastTime) {
            lastTime = curTime;
            sequence = 0;
        } else if (++sequence > 0x3FF) {
            lastTime++;
            sequence = 0;
        }
        return lastTime << 10 | sequence;
    }

}
