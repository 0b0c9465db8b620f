package modelmigration.store;

/**
 * A transaction was not applied because one of its assertions did not hold.
 *
 * <p>Nothing the transaction contained has been written. The failed operation
 * is available for diagnostics.
 */
public class TransactionAbortedException extends Exception {

    private final String failedOp;

    public TransactionAbortedException(String failedOp) {
        super("transaction aborted: " + failedOp);
        this.failedOp = failedOp;
    }

    /** Description of the operation whose assertion failed. */
    public String getFailedOp() {
        return failedOp;
    }
}
