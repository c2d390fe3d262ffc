package com.example.filegate.common.exception;

import lombok.Getter;

// Group list on a file record contains a token that is not a group id. Treated as a configuration error.
@Getter
public class InvalidGroupListException extends RuntimeException {

    private final String groupList;
    private final String invalidToken;

    public InvalidGroupListException(String groupList, String invalidToken) {
        super("Invalid group id '" + invalidToken + "' in group list '" + groupList + "'");
        this.groupList = groupList;
        this.invalidToken = invalidToken;
    }
}
