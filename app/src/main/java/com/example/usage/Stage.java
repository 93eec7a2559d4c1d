package com.example.usage;

public enum Stage { FETCH, NORMALIZE, FORMAT }
