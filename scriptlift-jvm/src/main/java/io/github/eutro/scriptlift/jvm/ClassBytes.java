package io.github.eutro.scriptlift.jvm;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.tree.ClassNode;

import java.io.IOException;
import java.io.InputStream;

public class ClassBytes {
    public static ClassReader getClassReaderFor(Class<?> clazz) {
        String path = "/" + clazz.getName().replace('.', '/') + ".class";
        try (InputStream classStream = clazz.getResourceAsStream(path)) {
            if (classStream == null) throw new IllegalStateException("Could not get class stream for " + clazz.getName());
            return new ClassReader(classStream);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Read a class into a tree, skipping debug information other than line numbers.
     *
     * @param clazz The class.
     * @return The class node.
     */
    public static ClassNode getClassNodeFor(Class<?> clazz) {
        ClassNode node = new ClassNode();
        getClassReaderFor(clazz).accept(node, ClassReader.SKIP_FRAMES);
        return node;
    }
}
