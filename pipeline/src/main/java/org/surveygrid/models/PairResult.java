package org.surveygrid.models;

/**
 * Outcome of one {@link SurveyYear} unit of work.
 */
public final class PairResult {

    public enum Status { SUCCEEDED, FAILED }

    private final SurveyYear pair;
    private final Status status;
    private final long fetched;
    private final long dropped;
    private final int persisted;
    private final String error;

    private PairResult(SurveyYear pair, Status status, long fetched, long dropped, int persisted, String error) {
        this.pair = pair;
        this.status = status;
        this.fetched = fetched;
        this.dropped = dropped;
        this.persisted = persisted;
        this.error = error;
    }

    public static PairResult succeeded(SurveyYear pair, long fetched, long dropped, int persisted) {
        return new PairResult(pair, Status.SUCCEEDED, fetched, dropped, persisted, null);
    }

    public static PairResult failed(SurveyYear pair, long fetched, Throwable cause) {
        return new PairResult(pair, Status.FAILED, fetched, 0, 0, String.valueOf(cause.getMessage()));
    }

    public SurveyYear getPair() { return pair; }
    public Status getStatus() { return status; }
    public long getFetched() { return fetched; }
    public long getDropped() { return dropped; }
    public int getPersisted() { return persisted; }
    public String getError() { return error; }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    @Override
    public String toString() {
        if (isSucceeded()) {
            return String.format("%s: fetched=%d dropped=%d persisted=%d", pair, fetched, dropped, persisted);
        }
        return String.format("%s: FAILED after %d records (%s)", pair, fetched, error);
    }
}
