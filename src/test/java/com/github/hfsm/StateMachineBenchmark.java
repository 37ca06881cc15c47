package com.github.hfsm;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.hfsm.StateMachineConfiguration.StateMachineConfigurationBuilder;
import com.github.hfsm.StateMachineEngine.StateMachineEngineBuilder;

public class StateMachineBenchmark {

  @Benchmark
  public void benchmarkTransactionFlow() throws StateMachineException {
    // 1. fire up an engine
    final StateMachineConfiguration config = StateMachineConfigurationBuilder.newBuilder()
        .actionDispatchMode(ActionDispatchMode.CALLER_THREAD).build();
    final StateMachineEngine engine = StateMachineEngineBuilder.newBuilder().config(config).build();
    boolean alive = engine.alive();

    // 2. load up the definitions
    final TransactionLifecycle lifecycle = new TransactionLifecycle(engine);

    // 3. bind a bank transaction settling two transactions
    final StateMachineInstance small = lifecycle.newTransaction("txn-100", 100L);
    final StateMachineInstance large = lifecycle.newTransaction("txn-150", 150L);
    final StateMachineInstance bankTransaction =
        lifecycle.newBankTransaction("bank-1", small, large);

    // 4a. draft->creating
    TransitionResult result = bankTransaction.fire("creating_via_api", TransitionContext.empty());

    // 4b. creating->pending, transactions draft->depositing
    result = bankTransaction.fire("created_via_api", TransitionContext.empty());

    // 4c. pending->settled, transactions depositing->deposited
    result = bankTransaction.fire("settled_via_api", TransitionContext.empty());
    State currentState = small.currentState();

    // 5. stop the engine
    final boolean stopped = engine.demolish();
    alive = engine.alive();
  }

  public static void main(String args[]) throws StateMachineException {
    StateMachineBenchmark benchmark = new StateMachineBenchmark();
    benchmark.benchmarkTransactionFlow();
  }

}
