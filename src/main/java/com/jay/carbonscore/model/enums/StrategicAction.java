package com.jay.carbonscore.model.enums;

public enum StrategicAction {
    NONE,
    MODAL_SHIFT,
    FOOD_WASTE,
    DATA_CENTER
}
