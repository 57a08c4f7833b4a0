package com.jay.carbonscore.model.enums;

/** Sector properties that select the recommendation template for a category. */
public enum SectorTrait {
    ENERGY_INTENSIVE,   // efficiency upgrade over green tariff, heat pump over insulation
    FLEET_OPERATOR,     // route optimisation + electrification over carpooling
    FUEL_INTENSIVE,     // eco-driving and biofuels
    FREIGHT_CARRIER     // purchase actions not relevant
}
