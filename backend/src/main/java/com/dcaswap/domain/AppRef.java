package com.dcaswap.domain;

/**
 * Delegated application a schedule was authorized for, and the permission version in force when it was last run.
 */
public record AppRef(long id, int version) {

    public AppRef withVersion(int newVersion) {
        return new AppRef(id, newVersion);
    }
}
