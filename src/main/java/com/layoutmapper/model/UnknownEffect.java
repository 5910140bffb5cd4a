package com.layoutmapper.model;

import lombok.Value;

@Value
public class UnknownEffect implements Effect {

    String rawType;

    boolean visible;

    @Override
    public EffectType getType() {
        return EffectType.UNKNOWN;
    }
}
