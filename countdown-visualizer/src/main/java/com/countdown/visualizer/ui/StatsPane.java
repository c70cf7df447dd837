package com.countdown.visualizer.ui;

import com.countdown.core.expr.Evaluation;
import com.countdown.core.solver.SearchTelemetry;
import com.countdown.visualizer.model.SolveFrame;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.VBox;

/**
 * Displays the expression and search counters of the current frame.
 */
public final class StatsPane extends VBox {

    private static final String EMPTY = "—";

    private final Label gameValue = valueLabel();
    private final Label expressionValue = valueLabel();
    private final Label resultValue = valueLabel();
    private final Label distanceValue = valueLabel();
    private final Label outcomeValue = valueLabel();
    private final Label examinedValue = valueLabel();
    private final Label duplicatesValue = valueLabel();
    private final Label invalidValue = valueLabel();
    private final Label generatedValue = valueLabel();
    private final Label peakQueueValue = valueLabel();
    private final Label searchTimeValue = valueLabel();

    public StatsPane() {
        setPadding(new Insets(16));
        setSpacing(12);
        setStyle("-fx-background-color: rgba(255,255,255,0.85); -fx-border-color: #d0d6e6; -fx-border-radius: 6; -fx-background-radius: 6;");
        setPrefWidth(340);
        setMinWidth(340);
        setMaxWidth(340);

        Label title = new Label("Search");
        title.setStyle("-fx-font-size: 18px; -fx-font-weight: bold;");

        expressionValue.setWrapText(true);
        gameValue.setWrapText(true);

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(8);

        addRow(grid, 0, "Game", gameValue);
        addRow(grid, 1, "Expression", expressionValue);
        addRow(grid, 2, "Value", resultValue);
        addRow(grid, 3, "Distance", distanceValue);
        addRow(grid, 4, "Outcome", outcomeValue);
        addRow(grid, 5, "Examined", examinedValue);
        addRow(grid, 6, "Duplicates", duplicatesValue);
        addRow(grid, 7, "Invalid", invalidValue);
        addRow(grid, 8, "Generated", generatedValue);
        addRow(grid, 9, "Peak queue", peakQueueValue);
        addRow(grid, 10, "Search time", searchTimeValue);

        getChildren().addAll(title, grid);
    }

    public void update(SolveFrame frame) {
        if (frame == null) {
            for (Label label : new Label[] {gameValue, expressionValue, resultValue, distanceValue, outcomeValue,
                    examinedValue, duplicatesValue, invalidValue, generatedValue, peakQueueValue,
                    searchTimeValue}) {
                label.setText(EMPTY);
            }
            return;
        }

        gameValue.setText(frame.game().toString());
        if (frame.hasExpression()) {
            Evaluation evaluation = frame.expression().evaluate();
            expressionValue.setText(frame.expression().render());
            resultValue.setText(evaluation.isValid() ? Integer.toString(evaluation.orElseThrow()) : EMPTY);
            distanceValue.setText(Integer.toString(frame.distance()));
        } else {
            expressionValue.setText(EMPTY);
            resultValue.setText(EMPTY);
            distanceValue.setText(EMPTY);
        }
        outcomeValue.setText(frame.isFinal() ? frame.outcome().name() : "Running");
        examinedValue.setText(Long.toString(frame.examined()));

        SearchTelemetry telemetry = frame.telemetry();
        if (frame.isFinal()) {
            duplicatesValue.setText(Long.toString(telemetry.duplicateStates()));
            invalidValue.setText(Long.toString(telemetry.invalidStates()));
            generatedValue.setText(Long.toString(telemetry.generatedStates()));
            peakQueueValue.setText(Integer.toString(telemetry.peakQueueSize()));
            searchTimeValue.setText(String.format("%.1f ms", telemetry.elapsedMillis()));
        } else {
            duplicatesValue.setText(EMPTY);
            invalidValue.setText(EMPTY);
            generatedValue.setText(EMPTY);
            peakQueueValue.setText(EMPTY);
            searchTimeValue.setText(EMPTY);
        }
    }

    private static void addRow(GridPane grid, int row, String label, Node value) {
        Label caption = new Label(label + ":");
        caption.setStyle("-fx-text-fill: #4a4f64; -fx-font-weight: 600;");
        grid.addRow(row, caption, value);
    }

    private static Label valueLabel() {
        Label label = new Label(EMPTY);
        label.setStyle("-fx-font-size: 14px; -fx-text-fill: #1f2333;");
        return label;
    }
}
