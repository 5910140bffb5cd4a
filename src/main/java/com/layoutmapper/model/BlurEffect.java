package com.layoutmapper.model;

import lombok.Value;

@Value
public class BlurEffect implements Effect {
    EffectType type;
    double radius;
    boolean visible;
}
