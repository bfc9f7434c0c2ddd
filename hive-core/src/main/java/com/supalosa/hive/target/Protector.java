package com.supalosa.hive.target;

/**
 * A target that fights back, and that parasites damage rather than drain.
 */
public interface Protector extends TargetUnit {

    @Override
    default TargetClass getTargetClass() {
        return TargetClass.PROTECTOR;
    }

    void takeDamage(double amount);
}
