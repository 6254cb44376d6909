package com.docloom.file;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.docloom.model.Document;
import com.docloom.model.DocumentMetadata;
import com.docloom.model.SourceType;
import com.docloom.source.SourceDescriptor;
import com.docloom.source.SourceLoader;

public class FileSourceLoader implements SourceLoader {

    @Override
    public List<Document> load(SourceDescriptor descriptor, Instant since) throws FileLoadException {
        String pattern = descriptor.locator();
        List<Document> documents = new ArrayList<>();
        for (FileLoader.LoadedFile file : FileLoader.withGlob(pattern).readWithPath()) {
            String path = file.path().toString().replace('\\', '/');
            documents.add(new Document(
                    "file:" + path,
                    descriptor.canonical(),
                    file.content(),
                    null,
                    DocumentMetadata.of(SourceType.FILE, pattern)));
        }
        return documents;
    }
}
