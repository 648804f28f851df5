package org.dxworks.cobolscope.batch;

import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.ast.AstReader;

import java.io.IOException;
import java.nio.file.Path;

/**
 * One program to analyze in a batch. Loading happens on the worker thread, so a document that cannot be read
 * fails only its own outcome.
 */
public interface AstSource {

    String id();

    AstNode load() throws IOException;

    static AstSource of(String id, AstNode program) {
        return new AstSource() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public AstNode load() {
                return program;
            }
        };
    }

    static AstSource file(Path path, AstReader reader) {
        return new AstSource() {
            @Override
            public String id() {
                return path.toString();
            }

            @Override
            public AstNode load() throws IOException {
                return reader.read(path);
            }
        };
    }
}
