/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.codemap.core.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemap.core.CodeMapException;
import ru.nts.tools.codemap.core.ErrorCode;
import ru.nts.tools.codemap.core.treesitter.LanguageDetector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Ленивый обход дерева проекта.
 * <p>
 * Скрытые и игнорируемые директории отсекаются до чтения их содержимого,
 * директории глубже {@code maxDepth} не обходятся, файлы больше
 * {@link #MAX_FILE_SIZE} пропускаются. Внутри директории сначала идут файлы,
 * затем поддиректории, и те и другие по имени.
 */
public final class RepositoryScanner {

    private static final Logger log = LoggerFactory.getLogger(RepositoryScanner.class);

    /**
     * Потолок размера файла в байтах.
     */
    public static final long MAX_FILE_SIZE = 1_000_000;

    private final Path root;
    private final int maxDepth;
    private final IgnoreRules ignoreRules;

    /**
     * @param root корень проекта
     * @param maxDepth максимальная глубина директорий (корень имеет глубину 0)
     * @throws CodeMapException PROJECT_NOT_FOUND если корня нет или это не директория
     */
    public RepositoryScanner(Path root, int maxDepth) {
        if (root == null || !Files.isDirectory(root)) {
            throw new CodeMapException(ErrorCode.PROJECT_NOT_FOUND, "root", String.valueOf(root));
        }
        if (maxDepth < 0) {
            throw new CodeMapException(ErrorCode.INVALID_PARAMETER, Map.of("name", "maxDepth", "value", maxDepth));
        }
        this.root = root.toAbsolutePath().normalize();
        this.maxDepth = maxDepth;
        this.ignoreRules = IgnoreRules.load(this.root);
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Все файлы проекта.
     */
    public Stream<FileDescriptor> scan() {
        return scan(null);
    }

    /**
     * Файлы проекта с указанными расширениями.
     *
     * @param includeExtensions расширения с точкой в нижнем регистре, null означает все
     * @return ленивый поток файлов
     */
    public Stream<FileDescriptor> scan(Set<String> includeExtensions) {
        Iterator<FileDescriptor> iterator = new ScanIterator(includeExtensions);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    String relativize(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private record PendingDirectory(Path path, int depth) {}

    /**
     * Обход в глубину с явным стеком директорий и буфером готовых файлов.
     */
    private final class ScanIterator implements Iterator<FileDescriptor> {

        private final Set<String> includeExtensions;
        private final Deque<PendingDirectory> directories = new ArrayDeque<>();
        private final Deque<FileDescriptor> ready = new ArrayDeque<>();

        ScanIterator(Set<String> includeExtensions) {
            this.includeExtensions = includeExtensions;
            directories.push(new PendingDirectory(root, 0));
        }

        @Override
        public boolean hasNext() {
            while (ready.isEmpty() && !directories.isEmpty()) {
                expand(directories.pop());
            }
            return !ready.isEmpty();
        }

        @Override
        public FileDescriptor next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return ready.poll();
        }

        private void expand(PendingDirectory directory) {
            List<Path> children;
            try (Stream<Path> list = Files.list(directory.path())) {
                children = list.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
            } catch (IOException e) {
                log.debug("Cannot list {}: {}", directory.path(), e.getMessage());
                return;
            }

            List<PendingDirectory> subdirectories = new ArrayList<>();
            int childDepth = directory.depth() + 1;

            for (Path child : children) {
                String name = child.getFileName().toString();
                String relativePath = relativize(child);

                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    if (name.startsWith(".") || ignoreRules.isIgnored(relativePath, true)) {
                        continue;
                    }
                    if (childDepth <= maxDepth) {
                        subdirectories.add(new PendingDirectory(child, childDepth));
                    }
                } else if (Files.isRegularFile(child)) {
                    acceptFile(child, relativePath);
                }
            }

            // Стек: кладём в обратном порядке, чтобы снимать по имени
            for (int i = subdirectories.size() - 1; i >= 0; i--) {
                directories.push(subdirectories.get(i));
            }
        }

        private void acceptFile(Path file, String relativePath) {
            if (ignoreRules.isIgnored(relativePath, false)) {
                return;
            }
            String extension = LanguageDetector.extensionOf(file);
            if (includeExtensions != null && !includeExtensions.contains(extension)) {
                return;
            }
            long size;
            try {
                size = Files.size(file);
            } catch (IOException e) {
                log.debug("Cannot stat {}: {}", file, e.getMessage());
                return;
            }
            if (size > MAX_FILE_SIZE) {
                log.debug("Skipping {} ({} bytes exceeds limit)", relativePath, size);
                return;
            }
            ready.add(new FileDescriptor(file, relativePath, extension, size, LanguageDetector.detect(file)));
        }
    }
}
