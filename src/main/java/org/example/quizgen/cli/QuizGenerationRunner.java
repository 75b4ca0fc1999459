package org.example.quizgen.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.quizgen.model.Difficulty;
import org.example.quizgen.model.QuizGenerationResult;
import org.example.quizgen.model.QuizQuestionView;
import org.example.quizgen.model.QuizRequest;
import org.example.quizgen.model.TypeCounts;
import org.example.quizgen.service.QuizGenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Generates one quiz from a local text file and prints it as JSON.
 *
 * Run with: mvn spring-boot:run -Dspring-boot.run.profiles=generate-cli -Dspring-boot.run.arguments="--quiz.cli.input=notes.txt --quiz.cli.mcq=5"
 * Or: java -jar target/quiz-generator.jar --spring.profiles.active=generate-cli --quiz.cli.input=notes.txt
 */
@Component
@Profile("generate-cli")
public class QuizGenerationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(QuizGenerationRunner.class);

    private final QuizGenerationService quizGenerationService;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Value("${quiz.cli.input:}")
    private String input;

    @Value("${quiz.cli.mcq:5}")
    private int mcq;

    @Value("${quiz.cli.short-answer:0}")
    private int shortAnswer;

    @Value("${quiz.cli.true-false:0}")
    private int trueFalse;

    @Value("${quiz.cli.identification:0}")
    private int identification;

    @Value("${quiz.cli.essay:0}")
    private int essay;

    @Value("${quiz.cli.difficulty:Intermediate}")
    private String difficulty;

    @Autowired
    public QuizGenerationRunner(QuizGenerationService quizGenerationService, ObjectMapper objectMapper) {
        this(quizGenerationService, objectMapper, System.out);
    }

    QuizGenerationRunner(QuizGenerationService quizGenerationService, ObjectMapper objectMapper, PrintStream out) {
        this.quizGenerationService = quizGenerationService;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(String... args) throws Exception {
        if (input == null || input.isBlank()) {
            out.println("Usage: --spring.profiles.active=generate-cli --quiz.cli.input=<file>");
            out.println("  --quiz.cli.mcq, --quiz.cli.short-answer, --quiz.cli.true-false,");
            out.println("  --quiz.cli.identification, --quiz.cli.essay   question counts");
            out.println("  --quiz.cli.difficulty                          Easy, Intermediate or Difficult");
            return;
        }

        Path path = Path.of(input);
        String text = Files.readString(path, StandardCharsets.UTF_8);
        QuizRequest request = new QuizRequest(
                text,
                new TypeCounts(mcq, shortAnswer, trueFalse, identification, essay),
                Difficulty.fromLabel(difficulty)
        );

        log.info("Generating {} questions from {} ({} chars)", request.counts().total(), path, text.length());
        QuizGenerationResult result = quizGenerationService.generate(request);
        List<QuizQuestionView> items = result.items().stream()
                .map(item -> QuizQuestionView.of(null, item))
                .toList();
        out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(items));
        log.info("Done: model={}, toppedUp={}", result.model(), result.toppedUp());
    }
}
