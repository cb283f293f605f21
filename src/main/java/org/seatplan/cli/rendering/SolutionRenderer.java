package org.seatplan.cli.rendering;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.seatplan.problem.Person;
import org.seatplan.runtime.anneal.AnnealingResult;
import org.seatplan.runtime.model.Assignment;
import org.seatplan.runtime.model.Table;
import org.seatplan.runtime.scoring.ScoreSummary;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a final assignment into console output.
 */
public final class SolutionRenderer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final Map<String, String> companions;

    /**
     * @param companions companion pairs of the solved problem, used for the summary numbers
     */
    public SolutionRenderer(Map<String, String> companions) {
        this.companions = companions;
    }

    public String render(AnnealingResult result, OutputFormat format) {
        return switch (format) {
            case TEXT -> renderText(result.assignment());
            case JSON -> renderJson(result);
        };
    }

    /**
     * Renders the summary sentence followed by one block per table.
     */
    public String renderText(Assignment assignment) {
        ScoreSummary summary = ScoreSummary.of(assignment, companions);
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Found a solution where %d people are given a preference "
                        + "(i.e. %d people have not been allocated at least one of their preferences). "
                        + "%d preferences are given in total",
                summary.satisfiedPeople(), summary.unsatisfiedPeople(), summary.satisfiedPreferences()));
        sb.append('\n');
        if (summary.companionViolations() > 0) {
            sb.append(String.format("Warning: %d people are not seated with their companion\n", summary.companionViolations()));
        }
        sb.append('\n');

        List<Table> tables = assignment.getTables();
        for (int tableNo = 0; tableNo < tables.size(); tableNo++) {
            Table table = tables.get(tableNo);
            sb.append(String.format("Table %d (capacity %d)\n", tableNo, table.getCapacity()));
            for (Person person : table.getOccupants()) {
                sb.append("- ").append(person.name()).append('\n');
            }
            if (tableNo < tables.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    public String renderJson(AnnealingResult result) {
        ScoreSummary summary = ScoreSummary.of(result.assignment(), companions);
        SolutionReport report = new SolutionReport();
        report.satisfiedPeople = summary.satisfiedPeople();
        report.unsatisfiedPeople = summary.unsatisfiedPeople();
        report.satisfiedPreferences = summary.satisfiedPreferences();
        report.companionViolations = summary.companionViolations();
        report.score = result.score();
        report.rounds = result.rounds();
        report.seed = result.seed();
        report.tables = new ArrayList<>();
        for (Table table : result.assignment().getTables()) {
            SolutionReport.TableEntry entry = new SolutionReport.TableEntry();
            entry.capacity = table.getCapacity();
            entry.people = new ArrayList<>();
            for (Person person : table.getOccupants()) {
                entry.people.add(person.name());
            }
            report.tables.add(entry);
        }
        return GSON.toJson(report);
    }

    /**
     * JSON shape of a rendered solution.
     */
    static final class SolutionReport {

        static final class TableEntry {
            int capacity;
            List<String> people;
        }

        int satisfiedPeople;
        int unsatisfiedPeople;
        int satisfiedPreferences;
        int companionViolations;
        double score;
        int rounds;
        long seed;
        List<TableEntry> tables;
    }
}
