package org.bindforge.library;

/**
 * Stable handle of a type registered in a {@link Library}.
 *
 * @param value The position of the type in the library's type table.
 */
public record TypeId(int value) {

    @Override
    public String toString() {
        return "#" + value;
    }
}
