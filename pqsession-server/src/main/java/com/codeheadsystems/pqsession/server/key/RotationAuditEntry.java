package com.codeheadsystems.pqsession.server.key;

import java.time.Instant;

/**
 * One append-only audit record. Version and key id fields are null where they do not apply,
 * e.g. the old version of a first generation, or both for a backup.
 *
 * @param timestamp  when the action completed
 * @param action     what happened
 * @param keyType    affected key type, null for backup and restore
 * @param oldVersion version replaced
 * @param newVersion version installed
 * @param oldKeyId   key id replaced
 * @param newKeyId   key id installed
 * @param operator   who or what triggered the action
 * @param cause      free-form reason
 */
public record RotationAuditEntry(Instant timestamp,
                                 AuditAction action,
                                 KeyType keyType,
                                 Integer oldVersion,
                                 Integer newVersion,
                                 String oldKeyId,
                                 String newKeyId,
                                 String operator,
                                 String cause) {
}
