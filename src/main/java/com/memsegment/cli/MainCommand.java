package com.memsegment.cli;

import com.memsegment.config.Constants;
import com.memsegment.config.SegmentConfig;
import com.memsegment.document.BatchReader;
import com.memsegment.document.Document;
import com.memsegment.segment.PostingsList;
import com.memsegment.segment.Segment;
import com.memsegment.segment.SegmentBuilder;
import com.memsegment.segment.SegmentStats;
import com.memsegment.segment.TermDictionary;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "msb",
    description = "内存索引段构建工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.BuildSubcommand.class,
        MainCommand.TermsSubcommand.class,
        MainCommand.DocSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--stop-words"}, description = "启用英文停用词过滤")
    private boolean enableStopWords;

    @Option(names = {"--no-term-vectors"}, description = "未声明时不记录词项位置信息")
    private boolean noTermVectors;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("内存索引段构建工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    SegmentConfig buildConfig() {
        SegmentConfig config = SegmentConfig.defaults();
        config.setEnableStopWords(enableStopWords);
        config.setIncludeTermVectors(!noTermVectors);
        return config;
    }

    Segment buildSegment(Path batchFile) throws IOException {
        SegmentConfig config = buildConfig();
        List<Document> documents = new BatchReader(config).read(batchFile.toFile());
        return new SegmentBuilder(config).buildFromDocuments(documents);
    }

    private static int sanitizeLimit(int rawLimit) {
        if (rawLimit < 0) {
            System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
            return 0;
        }
        if (rawLimit > Constants.MAX_TERMS_LIMIT) {
            System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_TERMS_LIMIT);
            return Constants.MAX_TERMS_LIMIT;
        }
        return rawLimit;
    }

    @Command(name = "build", description = "从 JSON 批次构建段并输出统计")
    static class BuildSubcommand implements Callable<Integer> {

        @Parameters(description = "JSON 批次文件", arity = "1")
        private Path batchFile;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--stats-out"}, description = "将统计写入 JSON 文件")
        private Path statsOut;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                Segment segment = main.buildSegment(batchFile);
                SegmentStats stats = segment.stats(segmentIdOf(batchFile));
                if ("json".equalsIgnoreCase(format)) {
                    System.out.println(stats.toJson());
                } else {
                    printTextStats(segment, stats);
                }
                if (statsOut != null) {
                    stats.writeTo(statsOut.toFile());
                    System.out.println("统计已写入: " + statsOut);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 构建失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private void printTextStats(Segment segment, SegmentStats stats) {
            System.out.println("段统计");
            System.out.println("═══════════");
            System.out.println("文档数: " + stats.docCount());
            System.out.println("字段数: " + stats.fieldCount());
            System.out.println("倒排数: " + stats.postingCount());
            System.out.println("内存估算: " + formatBytes(stats.sizeBytes()));
            for (int fieldId = 0; fieldId < segment.fieldCount(); fieldId++) {
                System.out.printf("  [%d] %s terms=%d docValues=%s%n", fieldId, segment.fieldName(fieldId),
                    segment.terms(fieldId).size(), segment.hasDocValues(fieldId));
            }
        }

        private static String segmentIdOf(Path batchFile) {
            Path fileName = batchFile.getFileName();
            return fileName == null ? "segment" : fileName.toString();
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
        }
    }

    @Command(name = "terms", description = "列出字段词项及其文档数")
    static class TermsSubcommand implements Callable<Integer> {

        @Parameters(description = "JSON 批次文件", arity = "1")
        private Path batchFile;

        @Option(names = {"--field"}, description = "字段名", required = true)
        private String field;

        @Option(names = {"--prefix"}, description = "只列出指定前缀的词项")
        private String prefix;

        @Option(names = {"-l", "--limit"}, description = "输出数量限制", defaultValue = "" + Constants.DEFAULT_TERMS_LIMIT)
        private int limit;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                Segment segment = main.buildSegment(batchFile);
                TermDictionary dictionary = segment.dictionary(field);
                if (!dictionary.exists()) {
                    System.out.println("⚠️ 字段不存在: " + field);
                    return 1;
                }
                List<String> terms = prefix == null ? dictionary.terms() : dictionary.prefixTerms(prefix);
                int safeLimit = sanitizeLimit(limit);
                for (String term : terms.subList(0, Math.min(safeLimit, terms.size()))) {
                    PostingsList postingsList = dictionary.postingsList(term);
                    System.out.printf("%s\t%d%n", term, postingsList.count());
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 列出词项失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "doc", description = "输出文档的存储字段")
    static class DocSubcommand implements Callable<Integer> {

        @Parameters(description = "JSON 批次文件", arity = "1")
        private Path batchFile;

        @Option(names = {"-n", "--num"}, description = "文档号", required = true)
        private int docNum;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                Segment segment = main.buildSegment(batchFile);
                if (docNum < 0 || docNum >= segment.count()) {
                    System.out.println("⚠️ 文档号越界: " + docNum + "，共 " + segment.count() + " 篇");
                    return 1;
                }
                segment.visitDocument(docNum, (fieldName, value) -> {
                    System.out.printf("%s (%c) %s %s%n", fieldName, (char) value.typeTag(),
                        value.valueAsString(), Arrays.toString(value.arrayPositions()));
                    return true;
                });
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 读取文档失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
