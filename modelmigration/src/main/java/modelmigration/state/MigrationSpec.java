package modelmigration.state;

import modelmigration.exceptions.NotValidException;
import modelmigration.names.Tag;

/**
 * A request to migrate a model.
 *
 * @param initiatedBy the user asking for the migration
 * @param targetInfo where the model goes
 */
public record MigrationSpec(Tag initiatedBy, TargetInfo targetInfo) {

    /**
     * @throws NotValidException naming the first offending field
     */
    public void validate() throws NotValidException {
        if (initiatedBy == null || initiatedBy.kind() != Tag.Kind.USER || !initiatedBy.isValid()) {
            throw NotValidException.of("InitiatedBy", "InitiatedBy");
        }
        if (targetInfo == null) {
            throw NotValidException.of("TargetInfo", "empty TargetInfo");
        }
        targetInfo.validate();
    }
}
