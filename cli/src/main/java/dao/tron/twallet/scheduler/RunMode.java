package dao.tron.twallet.scheduler;

/**
 * Non-collecting execution strategies of a {@link Worker}, selectable from configuration.
 */
public enum RunMode {

    /** {@link Worker#run()}: one thread per lane, jobs of a lane one after another. */
    LANES,

    /** {@link Worker#runAllJoined()}: one thread per lane, jobs of a lane all at once. */
    ALL_JOINED,

    /** {@link Worker#runSingleThreaded(int)}: calling thread only, bounded batches. */
    SINGLE_THREADED
}
