package com.studiomanagement.booking.enums;

public enum EquipmentCategory {
    LIGHTING,
    BACKDROP,
    PROPS,
    OTHER
}
