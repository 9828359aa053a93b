package io.kwinctl.compile;

import io.kwinctl.template.Fragment;
import java.util.Objects;

/**
 * Target of a window action: an explicit window id, one entry of the current window stack, or all of it.
 */
public interface WindowReference {
    /**
     * Wrapper fragment that applies an action body to this target.
     */
    Fragment wrapper();

    static WindowReference defaultReference() {
        return new StackIndex(1);
    }

    record ExplicitId(String id) implements WindowReference {
        public ExplicitId {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public Fragment wrapper() {
            return Fragment.ACTION_ON_WINDOW_ID;
        }
    }

    record StackIndex(int index) implements WindowReference {
        public StackIndex {
            if (index < 1) {
                throw new IllegalArgumentException("Window stack positions start at 1: " + index);
            }
        }

        @Override
        public Fragment wrapper() {
            return Fragment.ACTION_ON_STACK_ITEM;
        }
    }

    record AllStack() implements WindowReference {
        @Override
        public Fragment wrapper() {
            return Fragment.ACTION_ON_STACK_ALL;
        }
    }
}
