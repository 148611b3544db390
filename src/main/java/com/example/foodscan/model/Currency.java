package com.example.foodscan.model;

public enum Currency {
    VIETNAMESE_DONG,
    INDIAN_RUPEE,
    UNSUPPORTED
}
