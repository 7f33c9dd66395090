// file: server/src/main/java/io/tagvault/server/error/BusinessRuleException.java
package io.tagvault.server.error;

/**
 * Well-formed request that the current state rejects (unknown id, duplicate name).
 */
public class BusinessRuleException extends TagVaultException {
    public BusinessRuleException(String message) {
        super(ErrorCode.BUSINESS_RULE_VIOLATION, message);
    }
}
