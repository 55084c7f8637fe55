package com.cashflow.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.cashflow.engine.GameEngine;
import com.cashflow.engine.TestGames;
import com.cashflow.exception.UnauthorizedActionException;
import com.cashflow.model.GameState;
import com.cashflow.model.TurnPhase;
import com.cashflow.model.action.GameAction;
import com.cashflow.session.ActionResult;
import com.cashflow.session.ConnectionRegistry;
import com.cashflow.session.GameSession;
import com.cashflow.session.GameSessionManager;
import com.cashflow.session.RoomActionQueue;
import com.cashflow.websocket.GameWebSocketHandler;

@ExtendWith(MockitoExtension.class)
class GameActionServiceTest {

    @Mock private GameSessionManager gameSessionManager;
    @Mock private RoomService roomService;
    @Mock private GameWebSocketHandler webSocketHandler;
    @Mock private GameSession failingSession;

    private RoomActionQueue roomActionQueue;
    private ConnectionRegistry connectionRegistry;
    private GameActionService gameActionService;
    private GameEngine engine;

    @BeforeEach
    void setUp() {
        roomActionQueue = new RoomActionQueue();
        connectionRegistry = new ConnectionRegistry();
        gameActionService = new GameActionService(gameSessionManager, roomActionQueue, roomService,
                connectionRegistry, webSocketHandler);
        engine = TestGames.engine();
    }

    @AfterEach
    void tearDown() {
        roomActionQueue.shutdown();
    }

    private void startSession(GameState state) {
        when(gameSessionManager.getSession("room-1"))
                .thenReturn(new GameSession("room-1", engine, new Random(7), state));
    }

    @Nested
    @DisplayName("submitWithSessionToken()")
    class WithSessionToken {

        @Test
        @DisplayName("should apply the action and broadcast the new state")
        void shouldApplyAndBroadcast() {
            startSession(TestGames.twoPlayerGame(engine));

            ActionResult result = gameActionService
                    .submitWithSessionToken("room-1", new GameAction.RollDice("alice", null, null), "token-a")
                    .join();

            assertTrue(result.success());
            assertEquals(TurnPhase.RESOLVE_SPACE, result.state().getTurnPhase());
            verify(roomService).authorize("room-1", "alice", "token-a");
            verify(webSocketHandler).broadcastGameState("room-1", result.state());
            verify(webSocketHandler, never()).broadcastError(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("should report a rejected action to the room")
        void shouldBroadcastRejection() {
            startSession(TestGames.twoPlayerGame(engine));

            ActionResult result = gameActionService
                    .submitWithSessionToken("room-1", new GameAction.EndTurn("alice"), "token-a")
                    .join();

            assertFalse(result.success());
            verify(webSocketHandler).broadcastError("room-1", "alice", "Cannot end turn in current phase");
            verify(webSocketHandler, never()).broadcastGameState(anyString(), any());
        }

        @Test
        @DisplayName("should stop an unauthorized action before it is queued")
        void shouldRejectUnauthorized() {
            doThrow(new UnauthorizedActionException("session is not bound to player bob"))
                    .when(roomService).authorize("room-1", "bob", "token-a");

            assertThrows(UnauthorizedActionException.class, () -> gameActionService
                    .submitWithSessionToken("room-1", new GameAction.EndTurn("bob"), "token-a"));
            verify(gameSessionManager, never()).getSession(anyString());
        }

        @Test
        @DisplayName("should require the acting player")
        void shouldRequireActor() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> gameActionService
                    .submitWithSessionToken("room-1", new GameAction.EndTurn(null), "token-a"));
            assertEquals("Action must name the acting player", ex.getMessage());
        }

        @Test
        @DisplayName("should announce the winner and finish the room")
        void shouldFinishOnGameOver() {
            GameState fastTrack = TestGames.withCurrent(TestGames.twoPlayerGame(engine),
                    TestGames.engineer("alice", "Alice").toBuilder()
                            .escaped(true).inFastTrack(true).dream("Private Jet")
                            .fastTrackPosition(0).cash(0).fastTrackCashFlow(60000)
                            .build());
            GameState cashFlowDay = engine.processAction(fastTrack,
                    new GameAction.RollDice("alice", List.of(2, 2), null));
            startSession(cashFlowDay);

            ActionResult result = gameActionService
                    .submitWithSessionToken("room-1", new GameAction.CollectPayDay("alice"), "token-a")
                    .join();

            assertEquals(TurnPhase.GAME_OVER, result.state().getTurnPhase());
            verify(webSocketHandler).broadcastGameOver("room-1", "Alice");
            verify(roomService).finishRoom("room-1");
        }
    }

    @Nested
    @DisplayName("pipeline failures")
    class PipelineFailures {

        @Test
        @DisplayName("should report a session failure to the submitting player")
        void shouldReportSessionFailure() {
            when(gameSessionManager.getSession("room-1")).thenReturn(failingSession);
            when(failingSession.processAction(any())).thenThrow(new IllegalStateException("boom"));
            connectionRegistry.bind("conn-1", "room-1", "alice");

            CompletionException ex = assertThrows(CompletionException.class, () -> gameActionService
                    .submitFromConnection("room-1", new GameAction.EndTurn("alice"), "conn-1")
                    .join());

            assertEquals("boom", ex.getCause().getMessage());
            verify(webSocketHandler).broadcastError("room-1", "alice", GameActionService.ACTION_FAILED);
            verify(webSocketHandler, never()).broadcastGameState(anyString(), any());
        }

        @Test
        @DisplayName("should report an action that arrives after the room's queue closed")
        void shouldReportClosedRoom() {
            startSession(TestGames.twoPlayerGame(engine));
            roomActionQueue.close("room-1");

            assertThrows(CompletionException.class, () -> gameActionService
                    .submitWithSessionToken("room-1", new GameAction.RollDice("alice", null, null), "token-a")
                    .join());

            verify(webSocketHandler).broadcastError("room-1", "alice", GameActionService.ACTION_FAILED);
        }
    }

    @Nested
    @DisplayName("submitFromConnection()")
    class FromConnection {

        @Test
        @DisplayName("should accept actions from a bound connection")
        void shouldAcceptBoundConnection() {
            startSession(TestGames.twoPlayerGame(engine));
            connectionRegistry.bind("conn-1", "room-1", "alice");

            ActionResult result = gameActionService
                    .submitFromConnection("room-1", new GameAction.RollDice("alice", null, null), "conn-1")
                    .join();

            assertTrue(result.success());
        }

        @Test
        @DisplayName("should reject a connection bound to another player")
        void shouldRejectOtherPlayer() {
            connectionRegistry.bind("conn-1", "room-1", "bob");

            assertThrows(UnauthorizedActionException.class, () -> gameActionService
                    .submitFromConnection("room-1", new GameAction.RollDice("alice", null, null), "conn-1"));
        }

        @Test
        @DisplayName("should reject an unbound connection")
        void shouldRejectUnbound() {
            assertThrows(UnauthorizedActionException.class, () -> gameActionService
                    .submitFromConnection("room-1", new GameAction.EndTurn("alice"), "conn-9"));
            verify(gameSessionManager, never()).getSession(anyString());
        }
    }
}
