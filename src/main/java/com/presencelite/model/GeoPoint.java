package com.presencelite.model;

public record GeoPoint(double latitude, double longitude) {
}
