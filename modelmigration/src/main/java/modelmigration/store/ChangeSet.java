package modelmigration.store;

import java.util.List;

/**
 * Everything written by one committed transaction.
 *
 * @param revision the revision assigned to the transaction
 * @param changes the documents it wrote, one entry per document
 */
public record ChangeSet(long revision, List<DocumentChange> changes) {

    public ChangeSet {
        changes = List.copyOf(changes);
    }
}
