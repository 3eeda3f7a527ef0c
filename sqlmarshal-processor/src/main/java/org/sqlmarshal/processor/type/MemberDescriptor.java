package org.sqlmarshal.processor.type;

/// Field or no-argument accessor method of a type.
public record MemberDescriptor(String name, TypeDescriptor type, boolean accessor, boolean isPrivate) {
    public static MemberDescriptor field(String name, TypeDescriptor type, boolean isPrivate) {
        return new MemberDescriptor(name, type, false, isPrivate);
    }

    public static MemberDescriptor accessor(String name, TypeDescriptor type, boolean isPrivate) {
        return new MemberDescriptor(name, type, true, isPrivate);
    }

    /// Source expression reading this member from `target`.
    public String readFrom(String target) {
        return target + "." + name + (accessor ? "()" : "");
    }
}
