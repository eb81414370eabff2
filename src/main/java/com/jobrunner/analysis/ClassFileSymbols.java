package com.jobrunner.analysis;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the UTF-8 entries of a class file's constant pool: class and member
 * names, descriptors and string literals.
 */
public final class ClassFileSymbols {

    private static final int MAGIC = 0xCAFEBABE;

    private ClassFileSymbols() {
    }

    public static List<String> read(InputStream classFile) throws IOException {
        DataInputStream in = new DataInputStream(classFile);
        if (in.readInt() != MAGIC) {
            throw new IOException("Not a class file");
        }
        in.readUnsignedShort(); // minor
        in.readUnsignedShort(); // major

        int count = in.readUnsignedShort();
        List<String> symbols = new ArrayList<>();
        for (int i = 1; i < count; i++) {
            int tag = in.readUnsignedByte();
            switch (tag) {
                case 1 -> symbols.add(in.readUTF());
                case 7, 8, 16, 19, 20 -> in.skipNBytes(2);
                case 15 -> in.skipNBytes(3);
                case 3, 4, 9, 10, 11, 12, 17, 18 -> in.skipNBytes(4);
                case 5, 6 -> {
                    in.skipNBytes(8);
                    i++; // long and double take two slots
                }
                default -> throw new IOException("Unknown constant pool tag " + tag + " at index " + i);
            }
        }
        return symbols;
    }
}
