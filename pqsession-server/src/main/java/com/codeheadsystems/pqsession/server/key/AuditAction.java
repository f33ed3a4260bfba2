package com.codeheadsystems.pqsession.server.key;

public enum AuditAction {
  GENERATE,
  ROTATE,
  BACKUP,
  RESTORE
}
