package com.lexdraft.documents.model;

public enum JobType {
    TEXT_EXTRACTION
}
