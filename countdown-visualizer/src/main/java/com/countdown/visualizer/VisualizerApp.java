package com.countdown.visualizer;

import com.countdown.core.CountdownGame;
import com.countdown.core.solver.IterativeDeepeningSolver;
import com.countdown.core.solver.SolveConstraints;
import com.countdown.core.solver.SolveResult;
import com.countdown.core.solver.SolverOptions;
import com.countdown.visualizer.model.SolveFrame;
import com.countdown.visualizer.simulation.SolveTask;
import com.countdown.visualizer.ui.StatsPane;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import javafx.application.Application;
import javafx.beans.binding.Bindings;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.IntegerProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleIntegerProperty;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Label;
import javafx.scene.control.ListCell;
import javafx.scene.control.ListView;
import javafx.scene.control.ProgressBar;
import javafx.scene.control.Spinner;
import javafx.scene.control.SpinnerValueFactory;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.Region;
import javafx.scene.layout.VBox;
import javafx.stage.Stage;

public final class VisualizerApp extends Application {

    private static final int MAX_BUDGET = 50_000_000;
    private static final int MAX_TIME_LIMIT_MILLIS = 600_000;
    private static final Logger LOGGER = Logger.getLogger(VisualizerApp.class.getName());

    private final ObservableList<SolveFrame> frames = FXCollections.observableArrayList();
    private final IntegerProperty currentIndex = new SimpleIntegerProperty(0);
    private final BooleanProperty solving = new SimpleBooleanProperty(false);
    private final List<Spinner<Integer>> numberSpinners = new ArrayList<>();

    private final IterativeDeepeningSolver solver = new IterativeDeepeningSolver();
    private SolveConstraints initialConstraints = SolverOptions.DEFAULT_CONSTRAINTS;
    private Random random = new Random();
    private Integer initialLargeNumbers;

    private StatsPane statsPane;
    private ListView<SolveFrame> historyView;
    private Spinner<Integer> targetSpinner;
    private Spinner<Integer> largeNumbersSpinner;
    private Spinner<Integer> budgetSpinner;
    private Spinner<Integer> timeLimitSpinner;
    private ComboBox<SolveConstraints.SearchMode> searchModeComboBox;
    private ComboBox<SolveConstraints.LeafExpansion> leafExpansionComboBox;
    private ProgressBar progressBar;
    private Label statusLabel;
    private SolveTask solveTask;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage stage) {
        configureOptions(getParameters().getRaw());

        statsPane = new StatsPane();
        historyView = new ListView<>(frames);
        historyView.setCellFactory(view -> new ListCell<>() {
            @Override
            protected void updateItem(SolveFrame frame, boolean empty) {
                super.updateItem(frame, empty);
                if (empty || frame == null) {
                    setText(null);
                } else if (!frame.hasExpression()) {
                    setText(frame.game().toString());
                } else {
                    setText(String.format("%s = %d  (%d away, #%d)", frame.expression().render(),
                            frame.expression().evaluate().orElseThrow(), frame.distance(), frame.examined()));
                }
            }
        });
        historyView.getSelectionModel().selectedIndexProperty().addListener((obs, oldValue, newValue) -> {
            int index = newValue.intValue();
            if (index >= 0) {
                currentIndex.set(index);
            }
        });
        setupIndexListener();

        BorderPane root = new BorderPane();
        root.setPadding(new Insets(16));
        root.setTop(buildGameControls());
        BorderPane.setMargin(root.getTop(), new Insets(0, 0, 16, 0));
        root.setCenter(historyView);
        root.setRight(statsPane);
        BorderPane.setMargin(statsPane, new Insets(0, 0, 0, 16));

        HBox controls = buildSearchControls();
        root.setBottom(controls);
        BorderPane.setMargin(controls, new Insets(16, 0, 0, 0));

        newRandomGame();

        Scene scene = new Scene(root, 1200, 720);
        stage.setTitle("Countdown Visualizer");
        stage.setScene(scene);
        stage.setMinWidth(960);
        stage.setMinHeight(560);
        stage.show();
    }

    private void setupIndexListener() {
        currentIndex.addListener((obs, oldValue, newValue) -> {
            if (frames.isEmpty()) {
                statsPane.update(null);
                return;
            }
            int requested = newValue.intValue();
            int clamped = Math.max(0, Math.min(requested, frames.size() - 1));
            if (clamped != requested) {
                currentIndex.set(clamped);
                return;
            }
            statsPane.update(frames.get(clamped));
            historyView.getSelectionModel().select(clamped);
        });
    }

    private VBox buildGameControls() {
        HBox numbers = new HBox(8);
        numbers.setAlignment(Pos.CENTER_LEFT);
        numbers.getChildren().add(new Label("Numbers:"));
        for (int i = 0; i < CountdownGame.NUMBER_COUNT; i++) {
            Spinner<Integer> spinner = new Spinner<>();
            spinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(1, 100, 1));
            spinner.setEditable(true);
            spinner.setPrefWidth(80);
            spinner.disableProperty().bind(solving);
            numberSpinners.add(spinner);
            numbers.getChildren().add(spinner);
        }

        targetSpinner = new Spinner<>();
        targetSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(
                CountdownGame.MIN_TARGET, CountdownGame.MAX_TARGET, CountdownGame.MIN_TARGET));
        targetSpinner.setEditable(true);
        targetSpinner.setPrefWidth(90);
        targetSpinner.disableProperty().bind(solving);

        largeNumbersSpinner = new Spinner<>();
        largeNumbersSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(0,
                CountdownGame.MAX_LARGE_NUMBERS, initialLargeNumbers == null ? 2 : initialLargeNumbers));
        largeNumbersSpinner.setPrefWidth(70);
        largeNumbersSpinner.disableProperty().bind(solving);

        Button randomButton = new Button("Random game");
        randomButton.setOnAction(event -> newRandomGame());
        randomButton.disableProperty().bind(solving);

        HBox game = new HBox(8, new Label("Target:"), targetSpinner, new Label("Large:"), largeNumbersSpinner,
                randomButton);
        game.setAlignment(Pos.CENTER_LEFT);
        return new VBox(8, numbers, game);
    }

    private HBox buildSearchControls() {
        Button solveButton = new Button("Solve");
        solveButton.setOnAction(event -> runSolve());

        Button stopButton = new Button("Stop");
        stopButton.setOnAction(event -> stopSolve());

        Button previousButton = new Button("⏮");
        previousButton.setOnAction(event -> currentIndex.set(Math.max(0, currentIndex.get() - 1)));

        Button nextButton = new Button("⏭");
        nextButton.setOnAction(event -> currentIndex.set(Math.min(frames.size() - 1, currentIndex.get() + 1)));

        searchModeComboBox = new ComboBox<>();
        searchModeComboBox.getItems().setAll(SolveConstraints.SearchMode.values());
        searchModeComboBox.setValue(initialConstraints.mode());

        leafExpansionComboBox = new ComboBox<>();
        leafExpansionComboBox.getItems().setAll(SolveConstraints.LeafExpansion.values());
        leafExpansionComboBox.setValue(initialConstraints.leafExpansion());

        budgetSpinner = new Spinner<>();
        budgetSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(0, MAX_BUDGET,
                (int) Math.min(MAX_BUDGET, initialConstraints.stateBudget()), 10_000));
        budgetSpinner.setEditable(true);
        budgetSpinner.setPrefWidth(120);

        timeLimitSpinner = new Spinner<>();
        timeLimitSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(0, MAX_TIME_LIMIT_MILLIS,
                (int) Math.min(MAX_TIME_LIMIT_MILLIS, initialConstraints.timeLimit().toMillis()), 1000));
        timeLimitSpinner.setEditable(true);
        timeLimitSpinner.setPrefWidth(120);

        progressBar = new ProgressBar(0);
        progressBar.setPrefWidth(180);

        statusLabel = new Label("Ready");
        statusLabel.setMinWidth(160);

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);

        HBox navigation = new HBox(8, previousButton, nextButton);
        navigation.setAlignment(Pos.CENTER_LEFT);

        HBox controls = new HBox(12,
                solveButton,
                stopButton,
                new Label("Search mode:"),
                searchModeComboBox,
                new Label("Leaves:"),
                leafExpansionComboBox,
                new Label("State budget:"),
                budgetSpinner,
                new Label("Time limit (ms):"),
                timeLimitSpinner,
                navigation,
                spacer,
                progressBar,
                statusLabel);
        controls.setAlignment(Pos.CENTER_LEFT);

        var frameCount = Bindings.size(frames);
        previousButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> currentIndex.get() <= 0, currentIndex, frameCount));
        nextButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> frames.isEmpty() || currentIndex.get() >= frames.size() - 1, currentIndex, frameCount));
        solveButton.disableProperty().bind(solving);
        stopButton.disableProperty().bind(solving.not());
        searchModeComboBox.disableProperty().bind(solving);
        leafExpansionComboBox.disableProperty().bind(solving);
        budgetSpinner.disableProperty().bind(solving);
        timeLimitSpinner.disableProperty().bind(solving);

        return controls;
    }

    private void newRandomGame() {
        CountdownGame game = CountdownGame.generate(normalizeSpinnerValue(largeNumbersSpinner), random);
        List<Integer> numbers = game.numbers();
        for (int i = 0; i < numberSpinners.size(); i++) {
            numberSpinners.get(i).getValueFactory().setValue(numbers.get(i));
        }
        targetSpinner.getValueFactory().setValue(game.target());
        showFrames(List.of(SolveFrame.initial(game)));
        statusLabel.setText("Ready");
    }

    private void runSolve() {
        CountdownGame game;
        try {
            game = readGame();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Rejected game: " + ex.getMessage());
            statusLabel.setText("Invalid game: " + ex.getMessage());
            return;
        }

        SolveConstraints constraints = new SolveConstraints(
                searchModeComboBox.getValue(),
                leafExpansionComboBox.getValue(),
                Math.max(0, normalizeSpinnerValue(budgetSpinner)),
                Duration.ofMillis(Math.max(0, normalizeSpinnerValue(timeLimitSpinner))));
        LOGGER.info(() -> String.format("Solving %s with %s", game, constraints));

        showFrames(List.of(SolveFrame.initial(game)));
        SolveTask task = new SolveTask(solver, game, constraints, frame -> {
            frames.add(frame);
            currentIndex.set(frames.size() - 1);
        });
        solveTask = task;
        solving.set(true);
        progressBar.progressProperty().bind(task.progressProperty());
        statusLabel.textProperty().bind(task.messageProperty());

        task.setOnSucceeded(event -> {
            cleanupTaskBindings();
            SolveResult result = task.getValue();
            frames.add(SolveFrame.finished(game, result));
            currentIndex.set(frames.size() - 1);
            progressBar.setProgress(1.0);
            statusLabel.setText(task.getMessage());
        });

        task.setOnFailed(event -> {
            cleanupTaskBindings();
            Throwable error = task.getException();
            progressBar.setProgress(0);
            statusLabel.setText(error == null ? "Error" : "Error: " + error.getMessage());
            if (error != null) {
                LOGGER.log(Level.SEVERE, "Search failed", error);
            }
        });

        task.setOnCancelled(event -> {
            cleanupTaskBindings();
            progressBar.setProgress(0);
            statusLabel.setText("Cancelled");
        });

        Thread thread = new Thread(task, "countdown-visualizer-solve");
        thread.setDaemon(true);
        thread.start();
    }

    private void stopSolve() {
        if (solveTask != null) {
            solveTask.cancel(false);
        }
    }

    private void cleanupTaskBindings() {
        solving.set(false);
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();
        solveTask = null;
    }

    private CountdownGame readGame() {
        List<Integer> numbers = new ArrayList<>(numberSpinners.size());
        for (Spinner<Integer> spinner : numberSpinners) {
            numbers.add(normalizeSpinnerValue(spinner));
        }
        return new CountdownGame(numbers, normalizeSpinnerValue(targetSpinner));
    }

    private void showFrames(List<SolveFrame> initial) {
        frames.setAll(initial);
        currentIndex.set(0);
        statsPane.update(frames.get(0));
    }

    private int normalizeSpinnerValue(Spinner<Integer> spinner) {
        SpinnerValueFactory<Integer> factory = spinner.getValueFactory();
        if (factory != null) {
            try {
                Integer parsed = factory.getConverter().fromString(spinner.getEditor().getText());
                if (parsed != null) {
                    factory.setValue(parsed);
                }
            } catch (NumberFormatException ignored) {
                // Keep the previous value if parsing fails.
            }
        }
        Integer value = spinner.getValue();
        return value == null ? 0 : value;
    }

    private void configureOptions(List<String> args) {
        if (args == null || args.isEmpty()) {
            return;
        }
        try {
            SolverOptions options = SolverOptions.parse(args.toArray(new String[0]), 0);
            initialConstraints = options.constraints();
            random = options.random();
            initialLargeNumbers = options.largeNumbers();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Ignoring launch options", ex);
        }
    }
}
