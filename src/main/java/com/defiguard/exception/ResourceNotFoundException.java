package com.defiguard.exception;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(ErrorCode.NOT_FOUND, String.format("%s %s is not active or does not exist", resourceType, identifier));
    }
}
