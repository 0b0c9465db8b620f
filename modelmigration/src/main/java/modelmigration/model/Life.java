package modelmigration.model;

/**
 * Lifecycle state of a model.
 */
public enum Life {
    ALIVE,
    DYING,
    DEAD
}
