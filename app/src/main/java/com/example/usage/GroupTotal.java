package com.example.usage;

import java.math.BigDecimal;

public record GroupTotal<K>(K key, BigDecimal total, long recordCount) {}
