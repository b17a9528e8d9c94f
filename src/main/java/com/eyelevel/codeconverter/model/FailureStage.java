package com.eyelevel.codeconverter.model;

/**
 * Where in the pipeline an item failed.
 */
public enum FailureStage {
    ENCODE,
    UPLOAD
}
