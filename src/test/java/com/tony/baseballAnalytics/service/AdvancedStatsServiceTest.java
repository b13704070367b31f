package com.tony.baseballAnalytics.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tony.baseballAnalytics.config.AdvancedStatsProperties;
import com.tony.baseballAnalytics.exception.StatsNotFoundException;
import com.tony.baseballAnalytics.model.AtBatEvent;
import com.tony.baseballAnalytics.model.GameRecord;
import com.tony.baseballAnalytics.model.Hand;
import com.tony.baseballAnalytics.model.PlayerAdvancedStats;
import com.tony.baseballAnalytics.model.StatType;
import com.tony.baseballAnalytics.model.StatsComputationRun;
import com.tony.baseballAnalytics.model.dto.CalculationReport;
import com.tony.baseballAnalytics.model.dto.PbpGameRow;
import com.tony.baseballAnalytics.repository.MonthlyStatsRepository;
import com.tony.baseballAnalytics.repository.PbpRepository;
import com.tony.baseballAnalytics.repository.StatsComputationRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdvancedStatsServiceTest {

    private static final YearMonth JUNE = YearMonth.of(2025, 6);

    @Mock
    private PbpRepository pbpRepository;

    @Mock
    private MonthlyStatsRepository monthlyStatsRepository;

    @Mock
    private StatsComputationRunRepository runRepository;

    @Mock
    private PbpGameMapper gameMapper;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AdvancedStatsService service;

    @BeforeEach
    void setUp() {
        service = new AdvancedStatsService(pbpRepository, monthlyStatsRepository, runRepository,
                gameMapper, new PlayerRecordMerger(), new AdvancedStatsProperties());
    }

    private static List<GameRecord> juneGames() {
        List<AtBatEvent> atBats = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            atBats.add(AtBatEvent.builder()
                    .batterId("100").pitcherId("200")
                    .batterHand(Hand.R).pitcherHand(Hand.L)
                    .eventType("field_out").result("Groundout")
                    .build());
        }
        // Frappeur absent du fichier mensuel : jamais créé
        atBats.add(AtBatEvent.builder()
                .batterId("999").pitcherId("200")
                .batterHand(Hand.L).pitcherHand(Hand.L)
                .eventType("field_out").result("Flyout")
                .build());
        return List.of(GameRecord.builder().gameId("745001").level("AA").atBats(atBats).build());
    }

    private ObjectNode monthlyFile() throws Exception {
        return (ObjectNode) objectMapper.readTree("""
                {"year": 2025, "month": 6, "players": {
                  "100": {"name": "Batter", "batting": {"AVG": 0.310}},
                  "200": {"name": "Pitcher", "pitching": {"ERA": 3.10}}
                }}
                """);
    }

    @Test
    void calculateForMonth_ShouldUpdateExistingPlayersOnly() throws Exception {
        // ARRANGE
        List<PbpGameRow> rows = List.of(new PbpGameRow());
        ObjectNode monthly = monthlyFile();
        when(pbpRepository.findGamesForMonth(JUNE)).thenReturn(rows);
        when(gameMapper.toGameRecords(rows)).thenReturn(juneGames());
        when(monthlyStatsRepository.load(JUNE)).thenReturn(monthly);

        // ACT
        CalculationReport report = service.calculateForMonth(JUNE);

        // ASSERT
        assertThat(report.getGamesProcessed()).isEqualTo(1);
        assertThat(report.getBattersUpdated()).isEqualTo(1);
        assertThat(report.getPitchersUpdated()).isEqualTo(1);
        assertThat(report.getFailedPlayers()).isZero();

        JsonNode players = monthly.get("players");
        assertThat(players.has("999")).isFalse();
        assertThat(players.get("100").get("batting").get("GB%").asDouble()).isEqualTo(1.0);
        assertThat(players.get("100").get("batting").get("AVG").asDouble()).isEqualTo(0.310);
        assertThat(players.get("200").get("pitching").get("BIP").asInt()).isEqualTo(13);
        assertThat(players.get("200").get("pitchingSplits").has("vsR")).isTrue();

        verify(monthlyStatsRepository, times(1)).save(JUNE, monthly);
        ArgumentCaptor<StatsComputationRun> run = ArgumentCaptor.forClass(StatsComputationRun.class);
        verify(runRepository).save(run.capture());
        assertThat(run.getValue().getPeriod()).isEqualTo("2025-06");
        assertThat(run.getValue().getBattersUpdated()).isEqualTo(1);
    }

    @Test
    void calculateForMonth_ShouldClearAdvancedStatsOfPlayersWithoutPbp() throws Exception {
        // ARRANGE : le joueur 300 a des stats avancées d'un calcul précédent mais aucune présence au bâton
        List<PbpGameRow> rows = List.of(new PbpGameRow());
        ObjectNode monthly = monthlyFile();
        ((ObjectNode) monthly.get("players")).set("300", objectMapper.readTree("""
                {"name": "Bench",
                 "batting": {"AVG": 0.2, "GB%": 0.9, "HR/FB": 0.5, "BIP": 40},
                 "battingSplits": {"vsL": {"BIP": 12}, "last7": {"AVG": 0.1}},
                 "battingByLevel": {"AA": {"GB%": 0.9, "BIP": 40}}}
                """));
        when(pbpRepository.findGamesForMonth(JUNE)).thenReturn(rows);
        when(gameMapper.toGameRecords(rows)).thenReturn(juneGames());
        when(monthlyStatsRepository.load(JUNE)).thenReturn(monthly);

        // ACT
        CalculationReport report = service.calculateForMonth(JUNE);

        // ASSERT
        JsonNode bench = monthly.get("players").get("300");
        assertThat(bench.get("batting").toString()).isEqualTo("{\"AVG\":0.2}");
        assertThat(bench.get("battingSplits").has("vsL")).isFalse();
        assertThat(bench.get("battingSplits").get("last7").get("AVG").asDouble()).isEqualTo(0.1);
        assertThat(bench.has("battingByLevel")).isFalse();
        assertThat(bench.has("pitching")).isFalse();
        assertThat(report.getBattersUpdated()).isEqualTo(1);
    }

    @Test
    void calculateForMonth_WithoutPbp_ShouldNotTouchMonthlyFile() {
        when(pbpRepository.findGamesForMonth(JUNE)).thenReturn(List.of());
        when(gameMapper.toGameRecords(anyList())).thenReturn(List.of());

        CalculationReport report = service.calculateForMonth(JUNE);

        assertThat(report.playersUpdated()).isZero();
        verify(monthlyStatsRepository, never()).load(any());
        verify(monthlyStatsRepository, never()).save(any(), any());
        verifyNoInteractions(runRepository);
    }

    @Test
    void calculateForMonth_ShouldSurviveRunHistoryFailure() throws Exception {
        List<PbpGameRow> rows = List.of(new PbpGameRow());
        when(pbpRepository.findGamesForMonth(JUNE)).thenReturn(rows);
        when(gameMapper.toGameRecords(rows)).thenReturn(juneGames());
        when(monthlyStatsRepository.load(JUNE)).thenReturn(monthlyFile());
        when(runRepository.save(any(StatsComputationRun.class)))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        CalculationReport report = service.calculateForMonth(JUNE);

        assertThat(report.playersUpdated()).isEqualTo(2);
        verify(monthlyStatsRepository).save(eq(JUNE), any(ObjectNode.class));
    }

    @Test
    void mergeAll_ShouldRestorePlayerRecordOnFailure() throws Exception {
        PlayerRecordMerger failingMerger = mock(PlayerRecordMerger.class);
        AdvancedStatsService withFailingMerger = new AdvancedStatsService(pbpRepository, monthlyStatsRepository,
                runRepository, gameMapper, failingMerger, new AdvancedStatsProperties());

        ObjectNode players = (ObjectNode) monthlyFile().get("players");
        ObjectNode before = players.deepCopy();
        Map<String, PlayerAdvancedStats> computed = withFailingMerger.aggregate(juneGames())
                .getBatters().toAdvancedStats(
                        new AdvancedStatsProperties().statsPolicy(), new AdvancedStatsProperties().perGamePolicy());

        doAnswer(invocation -> {
            ObjectNode record = invocation.getArgument(0);
            record.put("partial", true);
            throw new IllegalStateException("boom");
        }).when(failingMerger).apply(any(ObjectNode.class), any(PlayerAdvancedStats.class));

        AdvancedStatsService.MergeCounts counts = withFailingMerger.mergeAll(players, StatType.BATTING, computed);

        assertThat(counts.updated).isZero();
        assertThat(counts.failed).isEqualTo(1);
        assertThat(players).isEqualTo(before);
    }

    @Test
    void calculateForYear_ShouldSumSeasonMonths() {
        when(pbpRepository.findGamesForMonth(any(YearMonth.class))).thenReturn(List.of());
        when(gameMapper.toGameRecords(anyList())).thenReturn(List.of());

        CalculationReport report = service.calculateForYear(2025);

        assertThat(report.getPeriod()).isEqualTo("2025");
        verify(pbpRepository, times(6)).findGamesForMonth(any(YearMonth.class));
        verify(pbpRepository).findGamesForMonth(YearMonth.of(2025, 4));
        verify(pbpRepository).findGamesForMonth(YearMonth.of(2025, 9));
    }

    @Test
    void getPlayerRecord_ShouldThrowWhenMonthIsMissing() {
        when(monthlyStatsRepository.exists(JUNE)).thenReturn(false);

        assertThatThrownBy(() -> service.getPlayerRecord(JUNE, "100"))
                .isInstanceOf(StatsNotFoundException.class);
    }

    @Test
    void getPlayerRecord_ShouldReturnStoredRecord() throws Exception {
        when(monthlyStatsRepository.exists(JUNE)).thenReturn(true);
        when(monthlyStatsRepository.load(JUNE)).thenReturn(monthlyFile());

        assertThat(service.getPlayerRecord(JUNE, "100").get("name").asText()).isEqualTo("Batter");
        assertThatThrownBy(() -> service.getPlayerRecord(JUNE, "404"))
                .isInstanceOf(StatsNotFoundException.class);
    }
}
