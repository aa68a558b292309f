package com.roadvision.core.counting;

/** Центр бокса в пикселях кадра. */
public record Center(int x, int y) {
}
