package com.newsrag.inference;

public enum AnswerMode {
    FOCUSED,
    ALL_CATEGORIES
}
