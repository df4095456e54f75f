package org.bindforge.library;

/**
 * The built-in types of the interface description. Every {@link Library}
 * pre-registers one {@link Type.FundamentalType} per constant, under its {@link #giName()}.
 */
public enum Fundamental {
    NONE("none"),
    BOOLEAN("gboolean"),
    INT8("gint8"),
    UINT8("guint8"),
    INT16("gint16"),
    UINT16("guint16"),
    INT32("gint32"),
    UINT32("guint32"),
    INT64("gint64"),
    UINT64("guint64"),
    CHAR("gchar"),
    UCHAR("guchar"),
    SHORT("gshort"),
    USHORT("gushort"),
    INT("gint"),
    UINT("guint"),
    LONG("glong"),
    ULONG("gulong"),
    SIZE("gsize"),
    SSIZE("gssize"),
    INT_PTR("gintptr"),
    UINT_PTR("guintptr"),
    FLOAT("gfloat"),
    DOUBLE("gdouble"),
    UNICHAR("gunichar"),
    POINTER("gpointer"),
    VAR_ARGS("va_list"),
    UTF8("utf8"),
    FILENAME("filename"),
    OS_STRING("os_string"),
    GTYPE("GType"),
    UNSUPPORTED("unsupported");

    private final String giName;

    Fundamental(String giName) {
        this.giName = giName;
    }

    /**
     * @return The name under which the fundamental is referenced in library descriptions.
     */
    public String giName() {
        return giName;
    }

    /**
     * @return {@code true} for the string-like fundamentals that carry their own length.
     */
    public boolean isString() {
        return this == UTF8 || this == FILENAME || this == OS_STRING;
    }
}
