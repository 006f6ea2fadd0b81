package com.example.facelandmarker.tasks;

public enum TaskErrorCode {
    INITIALIZATION,
    INVALID_INPUT,
    INVALID_MODE,
    SEQUENCING,
    INFERENCE
}
